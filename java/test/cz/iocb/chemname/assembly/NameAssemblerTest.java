package cz.iocb.chemname.assembly;

import static org.junit.Assert.assertEquals;
import org.junit.Test;
import cz.iocb.chemname.engine.NameGenerator;
import cz.iocb.chemname.engine.NameResult;
import cz.iocb.chemname.engine.NamingContext;



public class NameAssemblerTest
{
    private static final NameGenerator generator = new NameGenerator();


    private static String name(String smiles) throws Exception
    {
        return generator.generateNameFromSmiles(smiles).getName();
    }


    @Test
    public void testRetainedNames() throws Exception
    {
        NameResult result = generator.generateNameFromSmiles("CC(=O)O");

        assertEquals("acetic acid", result.getName());
        assertEquals(NamingContext.Method.RETAINED, result.getMethod());

        assertEquals("benzoic acid", name("OC(=O)c1ccccc1"));
        assertEquals("acetamide", name("CC(=O)N"));
        assertEquals("acetonitrile", name("CC#N"));
        assertEquals("phenol", name("Oc1ccccc1"));
    }


    @Test
    public void testSystematicSuffixes() throws Exception
    {
        assertEquals("butanoic acid", name("CCCC(=O)O"));
        assertEquals("propanal", name("CCC=O"));
        assertEquals("butanenitrile", name("CCCC#N"));
        assertEquals("hexane-1,6-diol", name("OCCCCCCO"));
    }


    @Test
    public void testFunctionalClassNames() throws Exception
    {
        NameResult result = generator.generateNameFromSmiles("CCCC(=O)OCC");

        assertEquals("ethyl butanoate", result.getName());
        assertEquals(NamingContext.Method.FUNCTIONAL_CLASS, result.getMethod());

        assertEquals("methyl acetate", name("CC(=O)OC"));
        assertEquals("acetyl chloride", name("CC(=O)Cl"));
    }


    @Test
    public void testCarbamate() throws Exception
    {
        assertEquals("(2-methylpropan-2-yl) carbamate", name("CC(C)(C)OC(=O)N"));
        assertEquals("ethyl carbamate", name("CCOC(=O)N"));
    }


    @Test
    public void testPrefixesAndSuffixes() throws Exception
    {
        assertEquals("2-chloroethanol", name("OCCCl"));
        assertEquals("3-methylbutan-2-one", name("CC(C)C(C)=O"));
        assertEquals("N-methylacetamide", name("CC(=O)NC"));
    }
}
