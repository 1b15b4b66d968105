package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Attachment of a non-skeletal fragment: the skeletal atom, the first atom of the fragment and the bond order between
 * them.
 */
public final class Branch
{
    private final int attachment;
    private final int root;
    private final int order;


    public Branch(int attachment, int root, int order)
    {
        this.attachment = attachment;
        this.root = root;
        this.order = order;
    }


    /**
     * Finds all fragments attached to the skeleton, ignoring the excluded atoms.
     */
    public static List<Branch> find(Molecule molecule, Collection<Integer> skeleton, Collection<Integer> excluded)
    {
        List<Branch> branches = new ArrayList<Branch>();

        for(int atom : skeleton)
        {
            for(int i = 0; i < molecule.getDegree(atom); i++)
            {
                int neighbour = molecule.getNeighbour(atom, i);

                if(skeleton.contains(neighbour) || excluded.contains(neighbour))
                    continue;

                branches.add(new Branch(atom, neighbour, molecule.getNeighbourBond(atom, i).getOrder()));
            }
        }

        return branches;
    }


    public int getAttachment()
    {
        return attachment;
    }


    public int getRoot()
    {
        return root;
    }


    public int getOrder()
    {
        return order;
    }


    @Override
    public String toString()
    {
        return attachment + (order == 2 ? "=" : order == 3 ? "#" : "-") + root;
    }
}
