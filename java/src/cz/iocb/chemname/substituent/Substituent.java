package cz.iocb.chemname.substituent;

import cz.iocb.chemname.numbering.Locant;



/**
 * Named substituent group attached to a parent structure.
 */
public final class Substituent
{
    private final int attachment;
    private final String prefixes;
    private final String stem;
    private final boolean compound;
    private final boolean acyl;
    private final boolean recognized;
    private final boolean approximate;
    private final Locant locant;


    /**
     * @param attachment skeletal atom of the parent carrying the substituent
     * @param prefixes detachable prefixes of the substituent itself, or an empty string
     * @param stem substituent name without its own prefixes ("propan-2-yl", "anilino")
     * @param compound whether the substituent is itself substituted and must be enclosed and multiplied by "bis"
     * @param acyl whether the substituent is an acyl group derived from a carboxylic acid ("acetyl")
     * @param recognized false if some part of the fragment has no known name
     * @param approximate whether some part is named by a construction of reduced confidence
     */
    public Substituent(int attachment, String prefixes, String stem, boolean compound, boolean acyl,
            boolean recognized, boolean approximate)
    {
        this(attachment, prefixes, stem, compound, acyl, recognized, approximate, null);
    }


    private Substituent(int attachment, String prefixes, String stem, boolean compound, boolean acyl,
            boolean recognized, boolean approximate, Locant locant)
    {
        this.attachment = attachment;
        this.prefixes = prefixes;
        this.stem = stem;
        this.compound = compound;
        this.acyl = acyl;
        this.recognized = recognized;
        this.approximate = approximate;
        this.locant = locant;
    }


    static Substituent simple(int attachment, String name)
    {
        return new Substituent(attachment, "", name, false, false, true, false);
    }


    public int getAttachment()
    {
        return attachment;
    }


    public String getName()
    {
        return prefixes + stem;
    }


    public String getPrefixes()
    {
        return prefixes;
    }


    public String getStem()
    {
        return stem;
    }


    public boolean isCompound()
    {
        return compound;
    }


    public boolean isAcyl()
    {
        return acyl;
    }


    public boolean isRecognized()
    {
        return recognized;
    }


    public boolean isApproximate()
    {
        return approximate;
    }


    /**
     * @return locant of the attachment atom, or null if it has not been assigned yet
     */
    public Locant getLocant()
    {
        return locant;
    }


    public Substituent withLocant(Locant locant)
    {
        return new Substituent(attachment, prefixes, stem, compound, acyl, recognized, approximate, locant);
    }


    public Substituent withAttachment(int attachment)
    {
        return new Substituent(attachment, prefixes, stem, compound, acyl, recognized, approximate, locant);
    }


    @Override
    public String toString()
    {
        return (locant == null ? "" : locant + "-") + getName();
    }
}
