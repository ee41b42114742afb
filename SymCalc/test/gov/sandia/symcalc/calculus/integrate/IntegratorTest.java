/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.calculus.integrate;

import static gov.sandia.symcalc.calculus.CalculusTest.assertSameValues;
import static gov.sandia.symcalc.language.ExpressionReader.read;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import gov.sandia.symcalc.Settings;
import gov.sandia.symcalc.calculus.Calculus;
import gov.sandia.symcalc.language.DepthExceededException;
import gov.sandia.symcalc.language.Operator;

import org.junit.Test;

/**
    Each integral is checked by differentiating it and comparing values with the integrand.
**/
public class IntegratorTest {

    protected void expectOK (Integrator integrator, String... integrands) throws NoIntegrationRuleException, DepthExceededException {
        for (String i : integrands) {
            Operator f = read (i);
            Operator F = integrator.integrate (f, "x");
            assertSameValues (i + " --> " + F, f, Calculus.differentiate (F, "x"), 0.2, 0.5, 0.8);
        }
    }

    protected void expectFail (Integrator integrator, String... integrands) throws DepthExceededException {
        for (String i : integrands) {
            try {
                Operator F = integrator.integrate (read (i), "x");
                fail ("Expected no rule for " + i + " but got " + F);
            } catch (NoIntegrationRuleException e) {
                assertTrue (e.getMessage ().contains ("x"));
            }
        }
    }

    protected static Integrator only (IntegrationStrategy s) {
        List<IntegrationStrategy> strategies = Arrays.asList (s);
        return new Integrator (strategies);
    }

    @Test
    public void testPowerRule() throws Exception {
        Integrator integrator = only (new PowerRule ());
        expectOK (integrator, "5", "a", "x", "x^3", "4*x^7", "1/x", "3/x^2", "sqrt(x)", "x^a", "-x^2/b");
        expectFail (integrator, "sin(x)", "x*exp(x)", "(x+1)^2");
    }

    @Test
    public void testBasicTrigonometric() throws Exception {
        Integrator integrator = only (new BasicTrigonometric ());
        expectOK (integrator, "sin(x)", "cos(x)", "tan(x)", "cot(x)", "sec(x)", "csc(x)", "sec(x)^2", "csc(x)^2");
        expectFail (integrator, "sin(2*x)", "3*cos(x)");

        // Squares are rewritten and need the rest of the chain.
        expectOK (new Integrator (), "sin(x)^2", "cos(x)^2", "4*cos(x)^2");
    }

    @Test
    public void testExponential() throws Exception {
        Integrator integrator = only (new Exponential ());
        expectOK (integrator, "exp(x)", "2^x", "a^x");
        expectFail (integrator, "exp(2*x)", "x^2");
    }

    @Test
    public void testConstantMultiple() throws Exception {
        expectOK (new Integrator (), "3*sin(x)", "a*exp(x)", "-cos(x)", "sin(b)*sec(x)^2", "exp(x)/a");
    }

    @Test
    public void testSubstitution() throws Exception {
        expectOK
        (
            new Integrator (),
            "2*x*cos(x^2)",
            "x*exp(x^2)",
            "cos(2*x)",
            "exp(3*x+1)",
            "sin(a*x)",
            "(2*x+1)*(x^2+x)^3",
            "x/(x^2+1)",
            "x/sqrt(1-x^2)",
            "sin(x)*cos(x)",
            "3^(2*x)",
            "cos(x)/sin(x)^2",
            "exp(x)/(exp(x)+1)"
        );
    }

    @Test
    public void testIntegrationByParts() throws Exception {
        expectOK
        (
            new Integrator (),
            "ln(x)",
            "x*ln(x)",
            "x*exp(x)",
            "x*sin(x)",
            "x^2*cos(x)",
            "x^2*exp(x)",
            "atan(x)",
            "asin(x)",
            "log(x,10)"
        );
    }

    @Test
    public void testInverseTrigonometric() throws Exception {
        Integrator integrator = only (new InverseTrigonometric ());
        expectOK (integrator, "1/(x^2+1)", "3/(x^2+4)", "1/(4*x^2+1)", "1/(x^2+a^2)", "1/sqrt(1-x^2)", "2/sqrt(9-x^2)", "1/sqrt(a-x^2)");
        expectFail (integrator, "1/(x^2-1)", "1/(x^2+x+1)", "1/sqrt(x^2-1)");
    }

    @Test
    public void testSumDifference() throws Exception {
        expectOK (new Integrator (), "x^2+sin(x)-3", "exp(x)+1/x", "x*(x+1)", "(x+1)^3", "2*x-cos(x)+a");
    }

    @Test
    public void testNoRule() throws Exception {
        expectFail (new Integrator (), "exp(x^2)", "1/(x^2-1)", "f(x)", "sin(x)*exp(x)", "sin(x)/x", "x^x");
    }

    @Test
    public void testStrategiesDeclineUnrelatedInput() throws Exception {
        Integrator chain = new Integrator ();
        Operator f = read ("ln(x)^2*exp(x)");
        for (IntegrationStrategy s : chain.getStrategies ()) {
            assertNull (s.getClass ().getSimpleName (), s.integrate (f, "x", chain, 0));
        }
    }

    @Test
    public void testDepthLimit() throws Exception {
        int saved = Settings.integratorDepth;
        Settings.integratorDepth = 0;
        try {
            new Integrator ().integrate (read ("3*sin(x)"), "x");
            fail ("Expected DepthExceededException");
        } catch (DepthExceededException e) {
            assertTrue (e.depth == 0);
        } finally {
            Settings.integratorDepth = saved;
        }
    }
}
