package cz.iocb.chemname.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.group.GroupType;
import cz.iocb.chemname.molecule.AtomicNumbers;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Prepares functional class names of esters ("ethyl acetate"): the alkyl side of every principal ester is excluded
 * from the parent. An ester whose acyl part lies on the alkyl side of another ester is cited as a prefix instead.
 */
public final class EsterRule extends Rule
{
    public EsterRule()
    {
        super("esters", "esters by functional class nomenclature", "P-65.6.3.2.1", Phase.PARENT_SELECTION);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        for(FunctionalGroup group : context.getPrincipalGroups())
            if(group.getType() == GroupType.ESTER)
                return true;

        return false;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        Molecule molecule = context.getMolecule();

        List<FunctionalGroup> esters = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : context.getPrincipalGroups())
            if(group.getType() == GroupType.ESTER)
                esters.add(group);

        Collections.sort(esters, new Comparator<FunctionalGroup>()
        {
            @Override
            public int compare(FunctionalGroup a, FunctionalGroup b)
            {
                return Integer.compare(a.getCarbon(), b.getCarbon());
            }
        });

        Set<Integer> blocked = new HashSet<Integer>(context.getBlocked());
        List<FunctionalGroup> kept = new ArrayList<FunctionalGroup>();
        Set<FunctionalGroup> demoted = new HashSet<FunctionalGroup>();
        NamingContext.Builder builder = context.withStateUpdate();

        for(FunctionalGroup ester : esters)
        {
            if(blocked.contains(ester.getCarbon()))
            {
                demoted.add(ester);
                builder.trace(trace("ester on an alkyl component cited as a prefix", FunctionalGroupRule.atoms(ester)));
                continue;
            }

            int oxygen = esterOxygen(molecule, ester);
            Set<Integer> component = component(molecule, alkylRoot(molecule, ester), oxygen);

            blocked.addAll(component);
            kept.add(ester);
            builder.trace(trace("alkyl component of ester", component));
        }

        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : context.getGroups())
            groups.add(demoted.contains(group) ? group.withPrincipal(false) : group);

        return builder.groups(groups).esters(kept).blocked(blocked).build();
    }


    /**
     * @return the singly bonded oxygen atom of the ester group
     */
    static int esterOxygen(Molecule molecule, FunctionalGroup ester)
    {
        for(int atom : ester.getAtoms())
            if(molecule.getAtomicNumber(atom) == AtomicNumbers.O && molecule.getDegree(atom) == 2)
                return atom;

        throw new IllegalStateException("ester without an alkyl oxygen: " + ester);
    }


    /**
     * @return the first atom of the alkyl component bonded to the ester oxygen
     */
    static int alkylRoot(Molecule molecule, FunctionalGroup ester)
    {
        int oxygen = esterOxygen(molecule, ester);

        for(int neighbour : molecule.getNeighbours(oxygen))
            if(neighbour != ester.getCarbon())
                return neighbour;

        throw new IllegalStateException("ester without an alkyl component: " + ester);
    }


    private static Set<Integer> component(Molecule molecule, int root, int barrier)
    {
        Set<Integer> component = new HashSet<Integer>();
        Deque<Integer> queue = new ArrayDeque<Integer>();
        component.add(root);
        queue.add(root);

        while(!queue.isEmpty())
        {
            int atom = queue.poll();

            for(int neighbour : molecule.getNeighbours(atom))
                if(neighbour != barrier && component.add(neighbour))
                    queue.add(neighbour);
        }

        return component;
    }
}
