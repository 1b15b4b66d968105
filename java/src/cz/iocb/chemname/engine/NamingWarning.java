package cz.iocb.chemname.engine;



public final class NamingWarning
{
    public static enum Type
    {
        /** tied numberings render differently, the atom order decided */
        AMBIGUOUS_NUMBERING(0.9),

        /** a fragment has no known prefix and is cited as "unknown" */
        UNRECOGNIZED_FRAGMENT(0.5),

        /** competing senior groups, resolved by lowest locants */
        SENIORITY_CONFLICT(1.0),

        /** a rule failed and was skipped */
        RULE_CONFLICT(1.0),

        /** the molecule has no skeleton to name */
        NO_PARENT(0.0);


        private final double penalty;


        private Type(double penalty)
        {
            this.penalty = penalty;
        }


        /**
         * @return factor applied to the confidence of the result
         */
        public double getPenalty()
        {
            return penalty;
        }
    }


    private final Type type;
    private final String ruleId;
    private final String message;


    public NamingWarning(Type type, String ruleId, String message)
    {
        this.type = type;
        this.ruleId = ruleId;
        this.message = message;
    }


    public Type getType()
    {
        return type;
    }


    public String getRuleId()
    {
        return ruleId;
    }


    public String getMessage()
    {
        return message;
    }


    @Override
    public String toString()
    {
        return type + " [" + ruleId + "]: " + message;
    }
}
