package cz.iocb.chemname.substituent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import cz.iocb.chemname.numbering.Locant;



/**
 * Identical substituents merged under one multiplying prefix, e.g. "3,5-bis(methylsulfanyl)".
 */
public final class PrefixGroup
{
    private final String name;
    private final boolean compound;
    private final List<Locant> locants;
    private final String key;


    PrefixGroup(String name, boolean compound, List<Locant> locants, String key)
    {
        List<Locant> sorted = new ArrayList<Locant>(locants);
        Collections.sort(sorted);

        this.name = name;
        this.compound = compound;
        this.locants = Collections.unmodifiableList(sorted);
        this.key = key;
    }


    public String getName()
    {
        return name;
    }


    public boolean isCompound()
    {
        return compound;
    }


    public List<Locant> getLocants()
    {
        return locants;
    }


    public int getCount()
    {
        return locants.size();
    }


    /**
     * @return alphanumerical ordering key: the letters of the name, multiplying prefixes of simple groups excluded
     */
    public String getKey()
    {
        return key;
    }


    @Override
    public String toString()
    {
        return Locant.join(locants) + "-" + name;
    }
}
