package cz.iocb.chemname.molecule;

import java.util.ArrayList;
import java.util.List;



/**
 * Collects atoms, bonds and rings and produces a validated immutable {@link Molecule}.
 */
public class MoleculeBuilder
{
    private static final String[] symbols = { "", "H", "He", "Li", "Be", "B", "C", "N", "O", "F", "Ne", "Na", "Mg",
            "Al", "Si", "P", "S", "Cl", "Ar", "K", "Ca", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn", "Ga",
            "Ge", "As", "Se", "Br", "Kr", "Rb", "Sr", "Y", "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd", "In",
            "Sn", "Sb", "Te", "I", "Xe", "Cs", "Ba", "La", "Ce", "Pr", "Nd", "Pm", "Sm", "Eu", "Gd", "Tb", "Dy", "Ho",
            "Er", "Tm", "Yb", "Lu", "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg", "Tl", "Pb", "Bi" };

    private final List<Atom> atoms = new ArrayList<Atom>();
    private final List<Bond> bonds = new ArrayList<Bond>();
    private final List<int[]> rings = new ArrayList<int[]>();


    public static int getAtomicNumber(String symbol)
    {
        for(int i = 1; i < symbols.length; i++)
            if(symbols[i].equals(symbol))
                return i;

        return AtomicNumbers.UNKNOWN;
    }


    public int addAtom(String symbol, int charge, boolean aromatic, int isotope, int hydrogenCount)
    {
        int id = atoms.size();
        atoms.add(new Atom(id, symbol, getAtomicNumber(symbol), charge, aromatic, isotope, hydrogenCount));
        return id;
    }


    public int addAtom(String symbol, int hydrogenCount)
    {
        return addAtom(symbol, 0, false, 0, hydrogenCount);
    }


    public int addBond(int atom1, int atom2, byte order, boolean aromatic, byte stereo, int ligand1, int ligand2)
    {
        int id = bonds.size();
        bonds.add(new Bond(id, atom1, atom2, order, aromatic, stereo, ligand1, ligand2));
        return id;
    }


    public int addBond(int atom1, int atom2, byte order, boolean aromatic)
    {
        return addBond(atom1, atom2, order, aromatic, Molecule.BondStereo.NONE, -1, -1);
    }


    public int addBond(int atom1, int atom2, byte order)
    {
        return addBond(atom1, atom2, order, false, Molecule.BondStereo.NONE, -1, -1);
    }


    public void addRing(int... ring)
    {
        rings.add(ring.clone());
    }


    public Molecule build() throws StructuralException
    {
        return new Molecule(atoms.toArray(new Atom[0]), bonds.toArray(new Bond[0]), rings);
    }
}
