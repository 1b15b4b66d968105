package cz.iocb.chemname.numbering;

import java.util.ArrayList;
import java.util.List;



/**
 * Structural features of a skeleton that the numbering rules compare. Atoms are molecule atom ids; the features do not
 * depend on any particular numbering.
 */
public final class NumberingFeatures
{
    static final class Heteroatom
    {
        final int atom;
        final int seniority;


        Heteroatom(int atom, int seniority)
        {
            this.atom = atom;
            this.seniority = seniority;
        }
    }


    static final class MultipleBond
    {
        final int atom1;
        final int atom2;
        final boolean isDouble;


        MultipleBond(int atom1, int atom2, boolean isDouble)
        {
            this.atom1 = atom1;
            this.atom2 = atom2;
            this.isDouble = isDouble;
        }
    }


    static final class Site
    {
        final int atom;
        final String key;
        final String name;


        Site(int atom, String key, String name)
        {
            this.atom = atom;
            this.key = key;
            this.name = name;
        }
    }


    final List<Heteroatom> heteroatoms = new ArrayList<Heteroatom>();
    final List<Integer> indicatedHydrogens = new ArrayList<Integer>();
    final List<Integer> principalAtoms = new ArrayList<Integer>();
    final List<MultipleBond> multipleBonds = new ArrayList<MultipleBond>();
    final List<Site> substituents = new ArrayList<Site>();


    /**
     * @param seniority rank of the element, lower is more senior (O before S before N ...)
     */
    public NumberingFeatures addHeteroatom(int atom, int seniority)
    {
        heteroatoms.add(new Heteroatom(atom, seniority));
        return this;
    }


    public NumberingFeatures addIndicatedHydrogen(int atom)
    {
        indicatedHydrogens.add(atom);
        return this;
    }


    /**
     * Adds an atom carrying a principal characteristic group or a free valence. An atom may be added repeatedly.
     */
    public NumberingFeatures addPrincipalAtom(int atom)
    {
        principalAtoms.add(atom);
        return this;
    }


    public NumberingFeatures addMultipleBond(int atom1, int atom2, boolean isDouble)
    {
        multipleBonds.add(new MultipleBond(atom1, atom2, isDouble));
        return this;
    }


    /**
     * @param key alphanumerical sort key of the prefix, or null when prefix names are not known yet
     */
    public NumberingFeatures addSubstituent(int atom, String key)
    {
        return addSubstituent(atom, key, key);
    }


    /**
     * Adds a substituent whose rendered name may differ from its ordering key, e.g. "1-chloroethyl" and
     * "2-chloroethyl" share the key "chloroethyl".
     */
    public NumberingFeatures addSubstituent(int atom, String key, String name)
    {
        substituents.add(new Site(atom, key, name));
        return this;
    }


    public int getSubstituentCount()
    {
        return substituents.size();
    }


    public int getMultipleBondCount()
    {
        return multipleBonds.size();
    }


    public int getDoubleBondCount()
    {
        int count = 0;

        for(MultipleBond bond : multipleBonds)
            if(bond.isDouble)
                count++;

        return count;
    }
}
