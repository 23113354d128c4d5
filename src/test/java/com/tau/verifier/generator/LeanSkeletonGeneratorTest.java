package com.tau.verifier.generator;

import com.tau.verifier.model.FunctionContract;
import com.tau.verifier.model.FunctionParameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeanSkeletonGeneratorTest {

    @Test
    void restatesEachFunctionAsAdmittedTheorem() {
        FunctionContract max = new FunctionContract("max",
                List.of(new FunctionParameter("a", "int"), new FunctionParameter("flag", "bool")),
                "int", "true", "result >= a", null, "a");

        String lean = new LeanSkeletonGenerator().generate(List.of(max), "M_max");

        assertEquals(String.join("\n",
                "-- Lean theorems for M_max",
                "set_option autoImplicit true",
                "set_option sorryPermitted true",
                "",
                "-- requires: true",
                "-- ensures: result >= a",
                "theorem max_correct (a : Int) (flag : Bool) : Prop := by",
                "  admit",
                ""), lean);
    }

    @Test
    void mapsTypes() {
        assertEquals("Int", LeanSkeletonGenerator.toLeanType("int"));
        assertEquals("Bool", LeanSkeletonGenerator.toLeanType("bool"));
    }
}
