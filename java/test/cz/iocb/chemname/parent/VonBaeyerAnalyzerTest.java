package cz.iocb.chemname.parent;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class VonBaeyerAnalyzerTest
{
    private static BridgedRingSystem analyze(String smiles) throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule(smiles);
        List<RingSystem> systems = new RingSystemAnalyzer().analyze(molecule);

        return VonBaeyerAnalyzer.analyze(molecule, systems.get(0));
    }


    @Test
    public void testBicycle() throws Exception
    {
        BridgedRingSystem system = analyze("C1CC2CCC1C2");

        assertEquals("[2.2.1]", system.getDescriptor().toString());
        assertEquals(2, system.getRingCount());
        assertEquals(7, system.getDescriptor().getAtomCount());
        assertFalse(system.getCandidateNumberings().isEmpty());
    }


    @Test
    public void testFusedBicycle() throws Exception
    {
        assertEquals("[4.4.0]", analyze("C1CCC2CCCCC2C1").getDescriptor().toString());
    }


    @Test
    public void testSecondaryBridge() throws Exception
    {
        BridgedRingSystem system = analyze("C1C2CC3CC1CC(C2)C3");

        assertEquals("[3.3.1.13,7]", system.getDescriptor().toString());
        assertEquals(3, system.getRingCount());
    }


    @Test(expected = IllegalArgumentException.class)
    public void testMonocycle() throws Exception
    {
        analyze("C1CCCCC1");
    }
}
