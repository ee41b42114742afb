/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

@RunWith(Suite.class)
@SuiteClasses({
    SettingsTest.class,
    gov.sandia.symcalc.language.AllTests.class,
    gov.sandia.symcalc.algebra.AllTests.class,
    gov.sandia.symcalc.calculus.AllTests.class,
    gov.sandia.symcalc.solve.AllTests.class
})

public class AllTests {}
