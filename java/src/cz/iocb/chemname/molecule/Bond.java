package cz.iocb.chemname.molecule;



public final class Bond
{
    private final int id;
    private final int atom1;
    private final int atom2;
    private final byte order;
    private final boolean aromatic;
    private final byte stereo;
    private final int stereoLigand1;
    private final int stereoLigand2;


    Bond(int id, int atom1, int atom2, byte order, boolean aromatic, byte stereo, int stereoLigand1,
            int stereoLigand2)
    {
        this.id = id;
        this.atom1 = atom1;
        this.atom2 = atom2;
        this.order = order;
        this.aromatic = aromatic;
        this.stereo = stereo;
        this.stereoLigand1 = stereoLigand1;
        this.stereoLigand2 = stereoLigand2;
    }


    public int getId()
    {
        return id;
    }


    public int getAtom1()
    {
        return atom1;
    }


    public int getAtom2()
    {
        return atom2;
    }


    /**
     * @return Kekule bond order, one of {@link Molecule.BondType} constants
     */
    public byte getOrder()
    {
        return order;
    }


    public boolean isAromatic()
    {
        return aromatic;
    }


    /**
     * @return one of {@link Molecule.BondStereo} constants, relative to the two stereo ligands
     */
    public byte getStereo()
    {
        return stereo;
    }


    /**
     * @return neighbour of atom1 the stereo marker refers to, or -1
     */
    public int getStereoLigand1()
    {
        return stereoLigand1;
    }


    /**
     * @return neighbour of atom2 the stereo marker refers to, or -1
     */
    public int getStereoLigand2()
    {
        return stereoLigand2;
    }


    public boolean contains(int atom)
    {
        return atom1 == atom || atom2 == atom;
    }


    public int getOther(int atom)
    {
        if(atom == atom1)
            return atom2;
        else if(atom == atom2)
            return atom1;

        throw new IllegalArgumentException("atom " + atom + " is not a member of bond " + id);
    }


    @Override
    public String toString()
    {
        return atom1 + (order == Molecule.BondType.DOUBLE ? "=" : order == Molecule.BondType.TRIPLE ? "#" : "-")
                + atom2;
    }
}
