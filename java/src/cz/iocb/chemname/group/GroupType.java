package cz.iocb.chemname.group;



/**
 * Classes of characteristic groups in decreasing seniority (P-41). Lower priority value means more senior.
 */
public enum GroupType
{
    CARBOXYLIC_ACID(10, true, true),
    ESTER(40, true, true),
    ACYL_HALIDE(50, true, true),
    AMIDE(60, true, true),
    NITRILE(70, true, true),
    ALDEHYDE(80, true, true),
    KETONE(90, true, false),
    ALCOHOL(100, true, false),
    THIOL(105, true, false),
    IMINE(110, true, false),
    NITRO(120, false, false),
    AMINE(130, true, false),
    ETHER(140, false, false),
    THIOETHER(170, false, false),
    HALIDE(200, false, false);


    private final int priority;
    private final boolean suffix;
    private final boolean carbonIncluded;


    private GroupType(int priority, boolean suffix, boolean carbonIncluded)
    {
        this.priority = priority;
        this.suffix = suffix;
        this.carbonIncluded = carbonIncluded;
    }


    public int getPriority()
    {
        return priority;
    }


    /**
     * @return whether the group can be cited as a suffix, otherwise it is expressed by prefixes only
     */
    public boolean isSuffix()
    {
        return suffix;
    }


    /**
     * @return whether the suffix includes the carbon atom of the group (e.g. "-oic acid" vs "-ol")
     */
    public boolean isCarbonIncluded()
    {
        return carbonIncluded;
    }
}
