package cz.iocb.chemname.parent;

import java.util.List;
import cz.iocb.chemname.numbering.Numbering;



/**
 * Polycyclic system named by von Baeyer nomenclature. Candidate numberings all conform to the selected descriptor.
 */
public final class BridgedRingSystem extends ParentStructure
{
    private final RingSystem system;
    private final VonBaeyerDescriptor descriptor;


    public BridgedRingSystem(RingSystem system, VonBaeyerDescriptor descriptor, List<Numbering> candidates)
    {
        super(system.getAtoms(), candidates, null);
        this.system = system;
        this.descriptor = descriptor;
    }


    private BridgedRingSystem(BridgedRingSystem parent, Numbering numbering)
    {
        super(parent.getAtoms(), parent.getCandidateNumberings(), numbering);
        this.system = parent.system;
        this.descriptor = parent.descriptor;
    }


    @Override
    public Kind getKind()
    {
        return Kind.BRIDGED_RING_SYSTEM;
    }


    @Override
    protected ParentStructure copy(Numbering numbering)
    {
        return new BridgedRingSystem(this, numbering);
    }


    public RingSystem getSystem()
    {
        return system;
    }


    public VonBaeyerDescriptor getDescriptor()
    {
        return descriptor;
    }


    @Override
    public int getRingCount()
    {
        return descriptor.getRingCount();
    }


    @Override
    public boolean isMancude()
    {
        return false;
    }
}
