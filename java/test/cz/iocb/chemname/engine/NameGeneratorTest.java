package cz.iocb.chemname.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.BeforeClass;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.group.GroupType;
import cz.iocb.chemname.molecule.StructuralException;



public class NameGeneratorTest
{
    private static NameGenerator generator;


    @BeforeClass
    public static void setup()
    {
        generator = new NameGenerator();
    }


    private static String name(String smiles) throws CDKException, StructuralException
    {
        NameResult result = generator.generateNameFromSmiles(smiles);
        assertFalse("naming of " + smiles + " failed", result.isError());
        return result.getName();
    }


    @Test
    public void testSimpleNames() throws Exception
    {
        assertEquals("ethanol", name("CCO"));
        assertEquals("ethane-1,2-diamine", name("NCCN"));
        assertEquals("but-2-ene", name("CC=CC"));
        assertEquals("propene", name("C=CC"));
    }


    @Test
    public void testLactamSuffixIsNotDuplicated() throws Exception
    {
        String name = name("O=C1CNCN1");

        assertEquals("imidazolidin-4-one", name);
        assertFalse(name.contains("amide"));
    }


    @Test
    public void testAlphanumericalPrefixOrder() throws Exception
    {
        assertEquals("6-methyl-3,5-bis(methylsulfanyl)-1,2,4-triazine", name("CC1=C(N=C(N=N1)SC)SC"));
    }


    @Test
    public void testAmideDemotedByEster() throws Exception
    {
        NameResult result = generator
                .generateNameFromSmiles("CCCC(=O)OC(C)(C)C(=O)NC1=CC(=C(C=C1)[N+](=O)[O-])C(F)(F)F");

        assertEquals("[2-methyl-1-[4-nitro-3-(trifluoromethyl)anilino]-1-oxopropan-2-yl] butanoate",
                result.getName());
        assertEquals(NamingContext.Method.FUNCTIONAL_CLASS, result.getMethod());

        boolean conflict = false;

        for(TraceEntry entry : result.getTrace())
            if(entry.getDescription().startsWith(NamingWarning.Type.SENIORITY_CONFLICT.name()))
                conflict = true;

        assertTrue(conflict);
    }


    @Test
    public void testPendantRingIsNotCounted() throws Exception
    {
        String name = name("C1CC2C3(CCC4C25CC(OC4OC5)C6=COC=C6)COC(=O)C3=C1");

        assertTrue(name, name.contains("pentacyclo"));
        assertFalse(name, name.contains("hexacyclo"));
    }


    @Test
    public void testBicycle() throws Exception
    {
        assertEquals("bicyclo[2.2.1]heptane", name("C1CC2CCC1C2"));
    }


    @Test
    public void testDeterminism() throws Exception
    {
        String smiles = "CC1=C(N=C(N=N1)SC)SC";
        NameResult first = generator.generateNameFromSmiles(smiles);

        for(int i = 0; i < 5; i++)
        {
            NameResult next = generator.generateNameFromSmiles(smiles);

            assertEquals(first.getName(), next.getName());
            assertEquals(first.getConfidence(), next.getConfidence(), 0.0);
            assertEquals(first.getTrace().size(), next.getTrace().size());
        }
    }


    @Test
    public void testDisconnectedMolecule() throws Exception
    {
        NameResult result = generator.generateNameFromSmiles("CCO.CCN");

        assertTrue(result.isError());
        assertEquals("", result.getName());
        assertEquals(0.0, result.getConfidence(), 0.0);
        assertNull(result.getMethod());
        assertTrue(result.hasWarning(NamingWarning.Type.NO_PARENT));
    }


    @Test
    public void testResultMetadata() throws Exception
    {
        NameResult result = generator.generateNameFromSmiles("CCO");

        assertEquals(NamingContext.Method.SYSTEMATIC, result.getMethod());
        assertEquals(1.0, result.getConfidence(), 1e-9);
        assertEquals(1, result.getFunctionalGroups().size());
        assertEquals(GroupType.ALCOHOL, result.getFunctionalGroups().get(0).getType());
        assertFalse(result.getFunctionalGroupTrace().isEmpty());

        for(TraceEntry entry : result.getTrace())
            assertTrue(entry.getReference().startsWith("P-"));
    }


    @Test
    public void testHydrocarbonWithoutGroups() throws Exception
    {
        NameResult result = generator.generateNameFromSmiles("CCCC");

        assertEquals("butane", result.getName());
        assertTrue(result.getFunctionalGroups().isEmpty());
    }


    @Test(expected = CDKException.class)
    public void testInvalidSmiles() throws Exception
    {
        generator.generateNameFromSmiles("C1CC(");
    }
}
