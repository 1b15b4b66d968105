package cz.iocb.chemname.parent;

import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.rules.RingTemplate;



/**
 * Monocyclic parent: carbocycle, retained heterocycle, Hantzsch-Widman ring or a large ring named by replacement
 * nomenclature.
 */
public final class SimpleRing extends ParentStructure
{
    private final RingTemplate template;
    private final boolean mancude;


    public SimpleRing(int[] ring, RingTemplate template, boolean mancude)
    {
        super(ring, cyclicNumberings(ring), null);
        this.template = template;
        this.mancude = mancude;
    }


    private SimpleRing(SimpleRing ring, Numbering numbering)
    {
        super(ring.getAtoms(), ring.getCandidateNumberings(), numbering);
        this.template = ring.template;
        this.mancude = ring.mancude;
    }


    @Override
    public Kind getKind()
    {
        return Kind.SIMPLE_RING;
    }


    @Override
    protected ParentStructure copy(Numbering numbering)
    {
        return new SimpleRing(this, numbering);
    }


    /**
     * @return retained ring matching the skeleton, or null
     */
    public RingTemplate getTemplate()
    {
        return template;
    }


    @Override
    public int getRingCount()
    {
        return 1;
    }


    @Override
    public boolean isMancude()
    {
        return mancude;
    }
}
