package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;



/**
 * The ordered rule table of the naming pipeline.
 */
public class NomenclatureRules
{
    private static final List<Rule> rules;


    static
    {
        List<Rule> list = new ArrayList<Rule>();

        list.add(new FunctionalGroupRule());
        list.add(new LactamRule());
        list.add(new PrincipalGroupRule());
        list.add(new ConnectivityRule());
        list.add(new EsterRule());
        list.add(new ParentSelectionRule());
        list.add(new NumberingRule());
        list.add(new SubstituentRule());
        list.add(new EsterComponentRule());
        list.add(new NameAssemblyRule());
        list.add(new FallbackRule());

        rules = Collections.unmodifiableList(list);
    }


    public static List<Rule> getRules()
    {
        return rules;
    }
}
