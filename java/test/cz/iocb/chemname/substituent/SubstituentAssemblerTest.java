package cz.iocb.chemname.substituent;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.parent.Branch;
import cz.iocb.chemname.parent.RingSystemAnalyzer;
import cz.iocb.chemname.rules.NomenclatureTables;



public class SubstituentAssemblerTest
{
    /**
     * Names the fragment bonded to atom 5 of a benzene ring written first in the SMILES, "c1ccccc1X".
     */
    private static Substituent onBenzene(String smiles) throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule(smiles);
        SubstituentAssembler assembler = new SubstituentAssembler(molecule, NomenclatureTables.getDefault(),
                new RingSystemAnalyzer().analyze(molecule));

        Set<Integer> ring = new HashSet<Integer>();

        for(int i = 0; i < 6; i++)
            ring.add(i);

        int order = molecule.getBond(5, 6).getOrder();

        return assembler.name(new Branch(5, 6, order), ring);
    }


    @Test
    public void testSimplePrefixes() throws Exception
    {
        assertEquals("methyl", onBenzene("c1ccccc1C").getName());
        assertEquals("hydroxy", onBenzene("c1ccccc1O").getName());
        assertEquals("chloro", onBenzene("c1ccccc1Cl").getName());
        assertEquals("nitro", onBenzene("c1ccccc1[N+](=O)[O-]").getName());
        assertEquals("cyano", onBenzene("c1ccccc1C#N").getName());
        assertEquals("methoxy", onBenzene("c1ccccc1OC").getName());
    }


    @Test
    public void testCompoundPrefixes() throws Exception
    {
        Substituent methylsulfanyl = onBenzene("c1ccccc1SC");

        assertEquals("methylsulfanyl", methylsulfanyl.getName());
        assertTrue(methylsulfanyl.isCompound());

        assertEquals("trifluoromethyl", onBenzene("c1ccccc1C(F)(F)F").getName());
    }


    @Test
    public void testChainPrefixes() throws Exception
    {
        assertEquals("propyl", onBenzene("c1ccccc1CCC").getName());
        assertEquals("cyclohexyl", onBenzene("c1ccccc1C2CCCCC2").getName());
    }


    @Test
    public void testUnknownFragment() throws Exception
    {
        Substituent substituent = onBenzene("c1ccccc1[Si](C)(C)C");

        assertFalse(substituent.isRecognized());
        assertTrue(substituent.getName().contains("unknown"));
    }


    @Test
    public void testMemoization() throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule("c1ccccc1CC");
        SubstituentAssembler assembler = new SubstituentAssembler(molecule, NomenclatureTables.getDefault(),
                new RingSystemAnalyzer().analyze(molecule));
        Set<Integer> excluded = new HashSet<Integer>();
        excluded.add(1);

        assertSame(assembler.name(new Branch(5, 6, 1), excluded), assembler.name(new Branch(5, 6, 1), excluded));
    }
}
