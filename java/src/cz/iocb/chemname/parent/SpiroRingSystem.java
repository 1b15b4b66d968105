package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemname.numbering.Numbering;



/**
 * Two monocycles sharing one atom, named spiro[x.y]. Numbering starts in the smaller ring next to the spiro atom.
 */
public final class SpiroRingSystem extends ParentStructure
{
    private final RingSystem system;
    private final int smallRing;
    private final int largeRing;


    public SpiroRingSystem(RingSystem system)
    {
        this(system, order(system));
    }


    private SpiroRingSystem(RingSystem system, int[][] rings)
    {
        super(system.getAtoms(), numberings(rings), null);
        this.system = system;
        this.smallRing = rings[0].length - 1;
        this.largeRing = rings[1].length - 1;
    }


    private SpiroRingSystem(SpiroRingSystem parent, Numbering numbering)
    {
        super(parent.getAtoms(), parent.getCandidateNumberings(), numbering);
        this.system = parent.system;
        this.smallRing = parent.smallRing;
        this.largeRing = parent.largeRing;
    }


    public static boolean isSupported(RingSystem system)
    {
        return system.getType() == RingSystem.Type.SPIRO && system.getRings().size() == 2;
    }


    /**
     * Rotates both rings to start at the spiro atom; the smaller ring goes first.
     */
    private static int[][] order(RingSystem system)
    {
        if(!isSupported(system))
            throw new IllegalArgumentException("only monospiro systems of two monocycles are supported");

        int[][] rings = new int[2][];

        for(int r = 0; r < 2; r++)
        {
            int[] ring = system.getRings().get(r);
            int start = 0;

            while(ring[start] != system.getSpiroAtom())
                start++;

            rings[r] = new int[ring.length];

            for(int i = 0; i < ring.length; i++)
                rings[r][i] = ring[(start + i) % ring.length];
        }

        if(rings[0].length > rings[1].length)
        {
            int[] swap = rings[0];
            rings[0] = rings[1];
            rings[1] = swap;
        }

        return rings;
    }


    private static List<Numbering> numberings(int[][] rings)
    {
        List<Numbering> numberings = new ArrayList<Numbering>();
        boolean symmetric = rings[0].length == rings[1].length;

        for(int first = 0; first < (symmetric ? 2 : 1); first++)
        {
            int[] small = rings[first];
            int[] large = rings[1 - first];

            for(int d1 = 0; d1 < 2; d1++)
            {
                for(int d2 = 0; d2 < 2; d2++)
                {
                    int[] order = new int[small.length + large.length - 1];
                    int index = 0;

                    for(int i = 1; i < small.length; i++)
                        order[index++] = small[d1 == 0 ? i : small.length - i];

                    order[index++] = small[0];

                    for(int i = 1; i < large.length; i++)
                        order[index++] = large[d2 == 0 ? i : large.length - i];

                    numberings.add(Numbering.sequential(order));
                }
            }
        }

        return numberings;
    }


    @Override
    public Kind getKind()
    {
        return Kind.SPIRO_RING_SYSTEM;
    }


    @Override
    protected ParentStructure copy(Numbering numbering)
    {
        return new SpiroRingSystem(this, numbering);
    }


    public RingSystem getSystem()
    {
        return system;
    }


    /**
     * @return number of atoms of the smaller ring, spiro atom excluded
     */
    public int getSmallRingSize()
    {
        return smallRing;
    }


    public int getLargeRingSize()
    {
        return largeRing;
    }


    @Override
    public int getRingCount()
    {
        return 2;
    }


    @Override
    public boolean isMancude()
    {
        return false;
    }
}
