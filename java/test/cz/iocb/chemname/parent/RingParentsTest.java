package cz.iocb.chemname.parent;

import static org.junit.Assert.assertEquals;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.rules.NomenclatureTables;



public class RingParentsTest
{
    private static ParentStructure create(String smiles) throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule(smiles);
        List<RingSystem> systems = new RingSystemAnalyzer().analyze(molecule);

        return RingParents.create(molecule, systems.get(0), NomenclatureTables.getDefault());
    }


    @Test
    public void testMonocycle() throws Exception
    {
        assertEquals(ParentStructure.Kind.SIMPLE_RING, create("c1ccncc1").getKind());
    }


    @Test
    public void testFusedTemplate() throws Exception
    {
        ParentStructure parent = create("c1ccc2ccccc2c1");

        assertEquals(ParentStructure.Kind.FUSED_RING_SYSTEM, parent.getKind());
        assertEquals("naphthalene", ((FusedRingSystem) parent).getTemplate().getName());
    }


    @Test
    public void testSaturatedPolycycle() throws Exception
    {
        assertEquals(ParentStructure.Kind.BRIDGED_RING_SYSTEM, create("C1CCC2CCCCC2C1").getKind());
    }


    @Test
    public void testSpiro() throws Exception
    {
        assertEquals(ParentStructure.Kind.SPIRO_RING_SYSTEM, create("C1CCC2(CC1)CCCC2").getKind());
    }
}
