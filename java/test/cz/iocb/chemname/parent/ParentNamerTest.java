package cz.iocb.chemname.parent;

import static org.junit.Assert.assertEquals;
import org.junit.Test;
import cz.iocb.chemname.engine.NameGenerator;



public class ParentNamerTest
{
    private static final NameGenerator generator = new NameGenerator();


    private static String name(String smiles) throws Exception
    {
        return generator.generateNameFromSmiles(smiles).getName();
    }


    @Test
    public void testChains() throws Exception
    {
        assertEquals("methane", name("C"));
        assertEquals("hexane", name("CCCCCC"));
        assertEquals("2-methylpropane", name("CC(C)C"));
        assertEquals("buta-1,3-diene", name("C=CC=C"));
        assertEquals("ethyne", name("C#C"));
    }


    @Test
    public void testElision() throws Exception
    {
        assertEquals("pentan-2-one", name("CC(=O)CCC"));
        assertEquals("propan-2-ol", name("CC(O)C"));
    }


    @Test
    public void testCarbocycles() throws Exception
    {
        assertEquals("benzene", name("c1ccccc1"));
        assertEquals("cyclohexane", name("C1CCCCC1"));
        assertEquals("cyclohexanol", name("OC1CCCCC1"));
        assertEquals("cyclohexene", name("C1=CCCCC1"));
        assertEquals("naphthalene", name("c1ccc2ccccc2c1"));
    }


    @Test
    public void testHeterocycles() throws Exception
    {
        assertEquals("pyridine", name("c1ccncc1"));
        assertEquals("piperidine", name("C1CCNCC1"));
        assertEquals("oxolane", name("C1CCOC1"));
    }


    @Test
    public void testPolycycles() throws Exception
    {
        assertEquals("bicyclo[4.4.0]decane", name("C1CCC2CCCCC2C1"));
        assertEquals("spiro[4.5]decane", name("C1CCC2(CC1)CCCC2"));
        assertEquals("adamantane", name("C1C2CC3CC1CC(C2)C3"));
    }


    @Test
    public void testElide()
    {
        assertEquals("propan", ParentNamer.elide("propane", "ol"));
        assertEquals("propane", ParentNamer.elide("propane", "nitrile"));
        assertEquals("propan", ParentNamer.elide("propane", "yl"));
    }
}
