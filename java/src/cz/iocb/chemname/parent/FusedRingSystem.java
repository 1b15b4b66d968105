package cz.iocb.chemname.parent;

import java.util.List;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.rules.RingTemplate;



/**
 * Ortho-fused aromatic ring system with a retained name. Every mapping of the retained numbering onto the skeleton is
 * a candidate numbering.
 */
public final class FusedRingSystem extends ParentStructure
{
    private final RingSystem system;
    private final RingTemplate template;


    public FusedRingSystem(RingSystem system, RingTemplate template, List<Numbering> candidates)
    {
        super(system.getAtoms(), candidates, null);
        this.system = system;
        this.template = template;
    }


    private FusedRingSystem(FusedRingSystem parent, Numbering numbering)
    {
        super(parent.getAtoms(), parent.getCandidateNumberings(), numbering);
        this.system = parent.system;
        this.template = parent.template;
    }


    @Override
    public Kind getKind()
    {
        return Kind.FUSED_RING_SYSTEM;
    }


    @Override
    protected ParentStructure copy(Numbering numbering)
    {
        return new FusedRingSystem(this, numbering);
    }


    public RingSystem getSystem()
    {
        return system;
    }


    public RingTemplate getTemplate()
    {
        return template;
    }


    @Override
    public int getRingCount()
    {
        return system.getRank();
    }


    @Override
    public boolean isMancude()
    {
        return true;
    }
}
