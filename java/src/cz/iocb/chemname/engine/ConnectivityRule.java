package cz.iocb.chemname.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Rejects empty molecules and molecules made of several components, which have no single parent.
 */
public final class ConnectivityRule extends Rule
{
    public ConnectivityRule()
    {
        super("connectivity", "single parent structure", "P-44", Phase.PARENT_SELECTION);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return countComponents(context.getMolecule()) != 1;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        int components = countComponents(context.getMolecule());
        String message = components == 0 ? "empty molecule" : "molecule consists of " + components + " components";

        return context.withStateUpdate().trace(trace(message))
                .error(warning(NamingWarning.Type.NO_PARENT, message)).build();
    }


    static int countComponents(Molecule molecule)
    {
        boolean[] visited = new boolean[molecule.getAtomCount()];
        Deque<Integer> queue = new ArrayDeque<Integer>();
        int components = 0;

        for(int start = 0; start < visited.length; start++)
        {
            if(visited[start])
                continue;

            components++;
            visited[start] = true;
            queue.add(start);

            while(!queue.isEmpty())
            {
                int atom = queue.poll();

                for(int neighbour : molecule.getNeighbours(atom))
                {
                    if(!visited[neighbour])
                    {
                        visited[neighbour] = true;
                        queue.add(neighbour);
                    }
                }
            }
        }

        return components;
    }
}
