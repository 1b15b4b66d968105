package cz.iocb.chemname.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.rules.NomenclatureTables;



public class RuleEngineTest
{
    private static class FailingRule extends Rule
    {
        FailingRule()
        {
            super("failing", "always fails", "P-0", Phase.NAME_ASSEMBLY);
        }


        @Override
        public boolean matches(NamingContext context)
        {
            return true;
        }


        @Override
        public NamingContext apply(NamingContext context)
        {
            throw new IllegalStateException("conflict");
        }
    }


    @Test
    public void testRuleFailureIsContained() throws Exception
    {
        List<Rule> rules = new ArrayList<Rule>(NomenclatureRules.getRules());
        rules.add(rules.size() - 2, new FailingRule());

        RuleEngine engine = new RuleEngine(rules);
        NamingContext context = NamingContext.create(MoleculeCreator.getMolecule("CCO"),
                NomenclatureTables.getDefault());
        NameResult result = engine.run(context);

        assertFalse(result.isError());
        assertTrue(result.hasWarning(NamingWarning.Type.RULE_CONFLICT));
        assertEquals("ethanol", result.getName());
    }


    @Test
    public void testAssemblerIsCreatedPerInvocation() throws Exception
    {
        NamingContext initial = NamingContext.create(MoleculeCreator.getMolecule("CCO"),
                NomenclatureTables.getDefault());
        FunctionalGroupRule rule = new FunctionalGroupRule();

        NamingContext first = rule.apply(initial);
        NamingContext second = rule.apply(initial);

        assertNull(initial.getAssembler());
        assertNotSame(first.getAssembler(), second.getAssembler());
        assertFalse(rule.matches(first));
    }


    @Test
    public void testEmptyRuleTableYieldsError() throws Exception
    {
        RuleEngine engine = new RuleEngine(new ArrayList<Rule>());
        NameResult result = engine.run(NamingContext.create(MoleculeCreator.getMolecule("CCO"),
                NomenclatureTables.getDefault()));

        assertTrue(result.isError());
        assertTrue(result.hasWarning(NamingWarning.Type.NO_PARENT));
    }


    @Test
    public void testRuleOrder()
    {
        List<Rule> rules = NomenclatureRules.getRules();

        for(int i = 1; i < rules.size(); i++)
            assertTrue(rules.get(i - 1).getPhase().compareTo(rules.get(i).getPhase()) <= 0);
    }
}
