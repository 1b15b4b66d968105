package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Enumerates unbranched chains in the forest formed by eligible acyclic atoms.
 */
public class ChainFinder
{
    private final Molecule molecule;
    private final boolean[] eligible;


    public ChainFinder(Molecule molecule, boolean[] eligible)
    {
        this.molecule = molecule;
        this.eligible = eligible;
    }


    /**
     * @return all chains running between two terminal atoms, each listed once
     */
    public List<int[]> findChains()
    {
        List<int[]> chains = new ArrayList<int[]>();

        for(int atom = 0; atom < eligible.length; atom++)
        {
            if(!eligible[atom] || countEligibleNeighbours(atom) > 1)
                continue;

            for(List<Integer> path : pathsFrom(atom, -1))
                if(path.get(path.size() - 1) >= atom)
                    chains.add(toArray(path));
        }

        return chains;
    }


    /**
     * @return all maximal chains that contain the given atom
     */
    public List<int[]> findChainsThrough(int root)
    {
        List<int[]> chains = new ArrayList<int[]>();
        List<List<Integer>> branches = new ArrayList<List<Integer>>();

        for(int neighbour : molecule.getNeighbours(root))
            if(eligible[neighbour])
                for(List<Integer> path : pathsFrom(neighbour, root))
                    branches.add(path);

        if(branches.isEmpty())
        {
            chains.add(new int[] { root });
            return chains;
        }

        if(countEligibleNeighbours(root) == 1)
        {
            for(List<Integer> branch : branches)
            {
                List<Integer> chain = new ArrayList<Integer>();
                chain.add(root);
                chain.addAll(branch);
                chains.add(toArray(chain));
            }

            return chains;
        }

        for(int i = 0; i < branches.size(); i++)
        {
            for(int j = i + 1; j < branches.size(); j++)
            {
                List<Integer> left = branches.get(i);
                List<Integer> right = branches.get(j);

                if(left.get(0).equals(right.get(0)))
                    continue;

                List<Integer> chain = new ArrayList<Integer>();

                for(int k = left.size() - 1; k >= 0; k--)
                    chain.add(left.get(k));

                chain.add(root);
                chain.addAll(right);
                chains.add(toArray(chain));
            }
        }

        return chains;
    }


    /**
     * @return paths from the atom to every terminal atom reachable without passing the excluded atom
     */
    private List<List<Integer>> pathsFrom(int start, int excluded)
    {
        List<List<Integer>> paths = new ArrayList<List<Integer>>();
        List<Integer> path = new ArrayList<Integer>();
        path.add(start);
        extend(path, excluded, paths);
        return paths;
    }


    private void extend(List<Integer> path, int previous, List<List<Integer>> paths)
    {
        int last = path.get(path.size() - 1);
        boolean extended = false;

        for(int neighbour : molecule.getNeighbours(last))
        {
            if(neighbour == previous || !eligible[neighbour] || path.contains(neighbour))
                continue;

            extended = true;
            path.add(neighbour);
            extend(path, last, paths);
            path.remove(path.size() - 1);
        }

        if(!extended)
            paths.add(new ArrayList<Integer>(path));
    }


    private int countEligibleNeighbours(int atom)
    {
        int count = 0;

        for(int neighbour : molecule.getNeighbours(atom))
            if(eligible[neighbour])
                count++;

        return count;
    }


    private static int[] toArray(List<Integer> list)
    {
        int[] array = new int[list.size()];

        for(int i = 0; i < array.length; i++)
            array[i] = list.get(i);

        return array;
    }
}
