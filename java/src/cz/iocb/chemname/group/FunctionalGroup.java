package cz.iocb.chemname.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;



/**
 * Characteristic group found in a molecule. Instances are immutable; numbering and principal-group selection produce
 * new instances.
 */
public final class FunctionalGroup
{
    private final GroupType type;
    private final String pattern;
    private final int[] atoms;
    private final int[] bonds;
    private final int carbon;
    private final int nitrogen;
    private final boolean absorbed;
    private final boolean principal;
    private final List<Locant> locants;


    public FunctionalGroup(GroupType type, String pattern, int[] atoms, int[] bonds, int carbon, int nitrogen,
            boolean absorbed)
    {
        this(type, pattern, atoms, bonds, carbon, nitrogen, absorbed, false, Collections.<Locant> emptyList());
    }


    private FunctionalGroup(GroupType type, String pattern, int[] atoms, int[] bonds, int carbon, int nitrogen,
            boolean absorbed, boolean principal, List<Locant> locants)
    {
        this.type = type;
        this.pattern = pattern;
        this.atoms = atoms;
        this.bonds = bonds;
        this.carbon = carbon;
        this.nitrogen = nitrogen;
        this.absorbed = absorbed;
        this.principal = principal;
        this.locants = locants;
    }


    public GroupType getType()
    {
        return type;
    }


    /**
     * @return identifier of the structural pattern that matched, e.g. "lactam" or "carboxylic-acid"
     */
    public String getPattern()
    {
        return pattern;
    }


    public int getPriority()
    {
        return type.getPriority();
    }


    /**
     * @return atoms expressed by the suffix when the group is principal
     */
    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public int[] getBonds()
    {
        return bonds.clone();
    }


    public boolean containsAtom(int atom)
    {
        for(int a : atoms)
            if(a == atom)
                return true;

        return false;
    }


    /**
     * @return carbon atom carrying the characteristic group, or -1 when it is not unique (amines)
     */
    public int getCarbon()
    {
        return carbon;
    }


    /**
     * @return nitrogen atom whose further substituents are cited with an "N" locant, or -1
     */
    public int getNitrogen()
    {
        return nitrogen;
    }


    /**
     * @return whether the group is already expressed by the name of the ring that contains it
     */
    public boolean isAbsorbed()
    {
        return absorbed;
    }


    public boolean isPrincipal()
    {
        return principal;
    }


    public List<Locant> getLocants()
    {
        return locants;
    }


    /**
     * Finds the skeletal atom of the given parent that carries the group.
     *
     * @return anchor atom, or -1 if the group is not attached to the parent
     */
    public int getAnchor(Molecule molecule, Set<Integer> parent)
    {
        if(type.isCarbonIncluded())
        {
            if(parent.contains(carbon))
                return carbon;

            for(int neighbour : molecule.getNeighbours(carbon))
                if(parent.contains(neighbour) && !containsAtom(neighbour))
                    return neighbour;

            return -1;
        }

        if(carbon >= 0)
            return parent.contains(carbon) ? carbon : -1;

        int anchor = -1;

        for(int atom : atoms)
            for(int neighbour : molecule.getNeighbours(atom))
                if(parent.contains(neighbour) && (anchor < 0 || neighbour < anchor))
                    anchor = neighbour;

        return anchor;
    }


    public FunctionalGroup withPrincipal(boolean principal)
    {
        return new FunctionalGroup(type, pattern, atoms, bonds, carbon, nitrogen, absorbed, principal, locants);
    }


    public FunctionalGroup withLocants(List<Locant> locants)
    {
        return new FunctionalGroup(type, pattern, atoms, bonds, carbon, nitrogen, absorbed, principal,
                Collections.unmodifiableList(new ArrayList<Locant>(locants)));
    }


    @Override
    public String toString()
    {
        return type + (locants.isEmpty() ? "" : locants.toString()) + (principal ? "*" : "");
    }
}
