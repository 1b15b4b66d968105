package cz.iocb.chemname.parent;

import java.util.Arrays;
import cz.iocb.chemname.numbering.Numbering;



/**
 * Unbranched acyclic chain; the atoms are listed from one end to the other.
 */
public final class Chain extends ParentStructure
{
    public Chain(int[] path)
    {
        super(path, Arrays.asList(Numbering.sequential(path), Numbering.sequential(reverse(path))), null);
    }


    private Chain(Chain chain, Numbering numbering)
    {
        super(chain.getAtoms(), chain.getCandidateNumberings(), numbering);
    }


    private static int[] reverse(int[] path)
    {
        int[] reversed = new int[path.length];

        for(int i = 0; i < path.length; i++)
            reversed[i] = path[path.length - 1 - i];

        return reversed;
    }


    @Override
    public Kind getKind()
    {
        return Kind.CHAIN;
    }


    @Override
    protected ParentStructure copy(Numbering numbering)
    {
        return new Chain(this, numbering);
    }


    @Override
    public int getRingCount()
    {
        return 0;
    }


    @Override
    public boolean isMancude()
    {
        return false;
    }
}
