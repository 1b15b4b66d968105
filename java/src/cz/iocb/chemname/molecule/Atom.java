package cz.iocb.chemname.molecule;



public final class Atom
{
    private final int id;
    private final String symbol;
    private final int atomicNumber;
    private final int charge;
    private final boolean aromatic;
    private final int isotope;
    private final int hydrogenCount;


    Atom(int id, String symbol, int atomicNumber, int charge, boolean aromatic, int isotope, int hydrogenCount)
    {
        this.id = id;
        this.symbol = symbol;
        this.atomicNumber = atomicNumber;
        this.charge = charge;
        this.aromatic = aromatic;
        this.isotope = isotope;
        this.hydrogenCount = hydrogenCount;
    }


    public int getId()
    {
        return id;
    }


    public String getSymbol()
    {
        return symbol;
    }


    public int getAtomicNumber()
    {
        return atomicNumber;
    }


    public int getCharge()
    {
        return charge;
    }


    public boolean isAromatic()
    {
        return aromatic;
    }


    /**
     * @return mass number, or 0 for natural isotopic composition
     */
    public int getIsotope()
    {
        return isotope;
    }


    public int getHydrogenCount()
    {
        return hydrogenCount;
    }


    public boolean isCarbon()
    {
        return atomicNumber == AtomicNumbers.C;
    }


    @Override
    public String toString()
    {
        return symbol + id;
    }
}
