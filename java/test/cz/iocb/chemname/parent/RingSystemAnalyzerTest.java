package cz.iocb.chemname.parent;

import static org.junit.Assert.assertEquals;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class RingSystemAnalyzerTest
{
    private static List<RingSystem> analyze(String smiles) throws Exception
    {
        return new RingSystemAnalyzer().analyze(MoleculeCreator.getMolecule(smiles));
    }


    @Test
    public void testSeparateRings() throws Exception
    {
        List<RingSystem> systems = analyze("c1ccccc1-c2ccccc2");

        assertEquals(2, systems.size());
        assertEquals(RingSystem.Type.MONOCYCLE, systems.get(0).getType());
        assertEquals(RingSystem.Type.MONOCYCLE, systems.get(1).getType());
    }


    @Test
    public void testSpiroSystem() throws Exception
    {
        List<RingSystem> systems = analyze("C1CCC2(CC1)CCCC2");

        assertEquals(1, systems.size());
        assertEquals(RingSystem.Type.SPIRO, systems.get(0).getType());
        assertEquals(3, systems.get(0).getSpiroAtom());
    }


    @Test
    public void testPendantRingIsSeparateSystem() throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule("C1CC2C3(CCC4C25CC(OC4OC5)C6=COC=C6)COC(=O)C3=C1");
        List<RingSystem> systems = new RingSystemAnalyzer().analyze(molecule);

        assertEquals(2, systems.size());

        RingSystem core = RingSystemAnalyzer.findSystem(systems, 0);
        RingSystem furan = RingSystemAnalyzer.findSystem(systems, 15);

        assertEquals(RingSystem.Type.POLYCYCLE, core.getType());
        assertEquals(5, core.getRank());
        assertEquals(RingSystem.Type.MONOCYCLE, furan.getType());
        assertEquals(1, furan.getRank());
    }
}
