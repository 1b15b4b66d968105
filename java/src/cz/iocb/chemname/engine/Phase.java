package cz.iocb.chemname.engine;



/**
 * Phases of the naming pipeline in the order in which they are visited.
 */
public enum Phase
{
    FUNCTIONAL_GROUP_DETECTION,
    PARENT_SELECTION,
    NUMBERING,
    SUBSTITUENT_ASSEMBLY,
    NAME_ASSEMBLY,
    DONE;


    public Phase next()
    {
        return this == DONE ? DONE : values()[ordinal() + 1];
    }
}
