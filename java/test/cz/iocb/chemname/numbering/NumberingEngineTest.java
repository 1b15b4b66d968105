package cz.iocb.chemname.numbering;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;



public class NumberingEngineTest
{
    private static final Numbering forward = Numbering.sequential(new int[] { 0, 1, 2, 3 });
    private static final Numbering backward = Numbering.sequential(new int[] { 3, 2, 1, 0 });


    @Test
    public void testPrincipalGroupGetsLowestLocant()
    {
        NumberingFeatures features = new NumberingFeatures();
        features.addPrincipalAtom(3);

        NumberingEngine.Result result = new NumberingEngine().choose(Arrays.asList(forward, backward), features);

        assertEquals(backward, result.getNumbering());
        assertFalse(result.isAmbiguous());
    }


    @Test
    public void testMultipleBondsBeforeSubstituents()
    {
        NumberingFeatures features = new NumberingFeatures();
        features.addMultipleBond(2, 3, true);
        features.addSubstituent(0, "methyl");

        NumberingEngine.Result result = new NumberingEngine().choose(Arrays.asList(forward, backward), features);

        assertEquals(backward, result.getNumbering());
    }


    @Test
    public void testSymmetricTieIsNotAmbiguous()
    {
        NumberingFeatures features = new NumberingFeatures();
        features.addSubstituent(0, "chloro");
        features.addSubstituent(3, "chloro");

        NumberingEngine.Result result = new NumberingEngine().choose(Arrays.asList(forward, backward), features);

        assertEquals(forward, result.getNumbering());
        assertFalse(result.isAmbiguous());
    }


    @Test
    public void testTieOfDifferentNamesIsAmbiguous()
    {
        NumberingFeatures features = new NumberingFeatures();
        features.addSubstituent(0, "chloroethyl", "1-chloroethyl");
        features.addSubstituent(3, "chloroethyl", "2-chloroethyl");

        NumberingEngine.Result result = new NumberingEngine().choose(Arrays.asList(backward, forward), features);

        assertEquals(forward, result.getNumbering());
        assertEquals(NumberingEngine.CRITERIA, result.getCriterion());
        assertTrue(result.isAmbiguous());
    }


    @Test
    public void testAlphabeticalOrderDecidesLastTie()
    {
        NumberingFeatures features = new NumberingFeatures();
        features.addSubstituent(0, "methyl");
        features.addSubstituent(3, "chloro");

        NumberingEngine.Result result = new NumberingEngine().choose(Arrays.asList(forward, backward), features);

        assertEquals(backward, result.getNumbering());
    }


    @Test
    public void testVectorComparison()
    {
        List<Locant> a = Arrays.asList(Locant.of(1), Locant.of(3));
        List<Locant> b = Arrays.asList(Locant.of(2), Locant.of(2));

        assertTrue(NumberingEngine.compareVectors(a, b) < 0);
        assertEquals(0, NumberingEngine.compareVectors(a, a));
    }
}
