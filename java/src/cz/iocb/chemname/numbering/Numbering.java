package cz.iocb.chemname.numbering;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;



/**
 * Assignment of locants to the skeletal atoms of a parent structure.
 */
public final class Numbering
{
    private final int[] atoms;
    private final Locant[] locants;
    private final Map<Integer, Integer> positions;


    public Numbering(int[] atoms, Locant[] locants)
    {
        if(atoms.length != locants.length)
            throw new IllegalArgumentException("atom and locant counts differ");

        this.atoms = atoms.clone();
        this.locants = locants.clone();
        this.positions = new HashMap<Integer, Integer>();

        for(int i = 0; i < atoms.length; i++)
            if(positions.put(atoms[i], i) != null)
                throw new IllegalArgumentException("atom " + atoms[i] + " numbered twice");
    }


    /**
     * Creates the numbering 1, 2, 3, ... of atoms in the given order.
     */
    public static Numbering sequential(int[] atoms)
    {
        Locant[] locants = new Locant[atoms.length];

        for(int i = 0; i < atoms.length; i++)
            locants[i] = Locant.of(i + 1);

        return new Numbering(atoms, locants);
    }


    public int size()
    {
        return atoms.length;
    }


    public int getAtom(int position)
    {
        return atoms[position];
    }


    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public Locant getLocantAt(int position)
    {
        return locants[position];
    }


    /**
     * @return locant of the atom, or null if the atom is not numbered
     */
    public Locant getLocant(int atom)
    {
        Integer position = positions.get(atom);
        return position == null ? null : locants[position];
    }


    /**
     * @return position of the atom in the numbering order, or -1
     */
    public int getPosition(int atom)
    {
        Integer position = positions.get(atom);
        return position == null ? -1 : position;
    }


    public boolean contains(int atom)
    {
        return positions.containsKey(atom);
    }


    @Override
    public boolean equals(Object object)
    {
        if(!(object instanceof Numbering))
            return false;

        Numbering other = (Numbering) object;
        return Arrays.equals(atoms, other.atoms) && Arrays.equals(locants, other.locants);
    }


    @Override
    public int hashCode()
    {
        return Arrays.hashCode(atoms) * 31 + Arrays.hashCode(locants);
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder("{");

        for(int i = 0; i < atoms.length; i++)
        {
            if(i > 0)
                builder.append(", ");

            builder.append(locants[i]).append('=').append(atoms[i]);
        }

        return builder.append('}').toString();
    }
}
