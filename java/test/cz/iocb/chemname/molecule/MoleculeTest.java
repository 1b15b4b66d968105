package cz.iocb.chemname.molecule;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;



public class MoleculeTest
{
    @Test
    public void testBuilder() throws StructuralException
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int c1 = builder.addAtom("C", 3);
        int c2 = builder.addAtom("C", 2);
        int o = builder.addAtom("O", 1);
        builder.addBond(c1, c2, (byte) 1);
        builder.addBond(c2, o, (byte) 1);

        Molecule molecule = builder.build();

        assertEquals(3, molecule.getAtomCount());
        assertEquals(2, molecule.getBondCount());
        assertEquals(2, molecule.getDegree(c2));
        assertEquals(AtomicNumbers.O, molecule.getAtomicNumber(o));
        assertNotNull(molecule.getBond(c1, c2));
        assertNull(molecule.getBond(c1, o));
        assertFalse(molecule.isRingAtom(c1));
    }


    @Test
    public void testAtomicNumbers()
    {
        assertEquals(AtomicNumbers.C, MoleculeBuilder.getAtomicNumber("C"));
        assertEquals(AtomicNumbers.Cl, MoleculeBuilder.getAtomicNumber("Cl"));
        assertEquals(AtomicNumbers.I, MoleculeBuilder.getAtomicNumber("I"));
        assertEquals(14, MoleculeBuilder.getAtomicNumber("Si"));
        assertEquals(AtomicNumbers.UNKNOWN, MoleculeBuilder.getAtomicNumber("Xx"));
    }


    @Test(expected = StructuralException.class)
    public void testMissingBondEndpoint() throws StructuralException
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        builder.addAtom("C", 4);
        builder.addBond(0, 5, (byte) 1);
        builder.build();
    }


    @Test(expected = StructuralException.class)
    public void testMissingRingMember() throws StructuralException
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        builder.addAtom("C", 2);
        builder.addAtom("C", 2);
        builder.addAtom("C", 2);
        builder.addBond(0, 1, (byte) 1);
        builder.addBond(1, 2, (byte) 1);
        builder.addBond(2, 0, (byte) 1);
        builder.addRing(0, 1, 7);
        builder.build();
    }


    @Test
    public void testSmiles() throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule("c1ccccc1O");

        assertEquals(7, molecule.getAtomCount());
        assertEquals(1, molecule.getRings().size());
        assertTrue(molecule.isRingAtom(0));
        assertFalse(molecule.isRingAtom(6));
        assertTrue(molecule.getAtom(0).isAromatic());
        assertEquals(1, molecule.getAtom(6).getHydrogenCount());
    }


    @Test
    public void testCharges() throws Exception
    {
        Molecule molecule = MoleculeCreator.getMolecule("C[N+](=O)[O-]");

        assertEquals(1, molecule.getAtom(1).getCharge());
        assertEquals(-1, molecule.getAtom(3).getCharge());
        assertEquals(2, molecule.getBond(1, 2).getOrder());
    }
}
