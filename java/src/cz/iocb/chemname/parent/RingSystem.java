package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Set of rings connected by shared bonds (a monocycle or a fused/bridged polycycle), or two monocycles sharing a single
 * atom (a spiro system).
 */
public final class RingSystem
{
    public static enum Type
    {
        MONOCYCLE, POLYCYCLE, SPIRO
    }


    private final Type type;
    private final int[] atoms;
    private final int[] bonds;
    private final List<int[]> rings;
    private final int spiroAtom;


    RingSystem(Type type, int[] atoms, int[] bonds, List<int[]> rings, int spiroAtom)
    {
        this.type = type;
        this.atoms = atoms.clone();
        this.bonds = bonds.clone();
        this.rings = Collections.unmodifiableList(new ArrayList<int[]>(rings));
        this.spiroAtom = spiroAtom;

        Arrays.sort(this.atoms);
        Arrays.sort(this.bonds);
    }


    public Type getType()
    {
        return type;
    }


    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public int getAtomCount()
    {
        return atoms.length;
    }


    public int[] getBonds()
    {
        return bonds.clone();
    }


    public List<int[]> getRings()
    {
        return rings;
    }


    public int getSpiroAtom()
    {
        return spiroAtom;
    }


    public boolean contains(int atom)
    {
        return Arrays.binarySearch(atoms, atom) >= 0;
    }


    public boolean containsBond(int bond)
    {
        return Arrays.binarySearch(bonds, bond) >= 0;
    }


    /**
     * @return cyclomatic number of the system: bonds - atoms + 1
     */
    public int getRank()
    {
        return bonds.length - atoms.length + 1;
    }


    public int getHeteroatomCount(Molecule molecule)
    {
        int count = 0;

        for(int atom : atoms)
            if(!molecule.isCarbon(atom))
                count++;

        return count;
    }


    public boolean isAromatic(Molecule molecule)
    {
        for(int atom : atoms)
            if(!molecule.getAtom(atom).isAromatic())
                return false;

        return true;
    }


    @Override
    public String toString()
    {
        return type + Arrays.toString(atoms);
    }
}
