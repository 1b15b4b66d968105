package cz.iocb.chemname.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.group.FunctionalGroup;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.numbering.NumberingEngine;
import cz.iocb.chemname.numbering.NumberingFeatures;
import cz.iocb.chemname.parent.Branch;
import cz.iocb.chemname.parent.ParentSelector;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.SkeletonFeatures;
import cz.iocb.chemname.substituent.Prefixes;
import cz.iocb.chemname.substituent.Substituent;



/**
 * Numbers the parent structure by the criteria of lowest locants.
 */
public final class NumberingRule extends Rule
{
    private final NumberingEngine engine = new NumberingEngine();


    public NumberingRule()
    {
        super("numbering", "lowest locants", "P-31.1.4", Phase.NUMBERING);
    }


    @Override
    public boolean matches(NamingContext context)
    {
        return context.getParent() != null && context.getParent().getNumbering() == null;
    }


    @Override
    public NamingContext apply(NamingContext context)
    {
        ParentStructure parent = context.getParent();
        NumberingFeatures features = SkeletonFeatures.collect(context.getMolecule(), parent, context.getTables());

        for(FunctionalGroup group : context.getPrincipalGroups())
            features.addPrincipalAtom(ParentSelector.anchorOf(context.getMolecule(), group, parent));

        Set<Integer> excluded = context.getExcludedAtoms();
        Set<Integer> inner = new HashSet<Integer>(excluded);
        inner.addAll(parent.getAtomSet());

        for(Branch branch : Branch.find(context.getMolecule(), parent.getAtomSet(), excluded))
        {
            Substituent substituent = context.getAssembler().name(branch, inner);
            features.addSubstituent(branch.getAttachment(), Prefixes.key(substituent.getName()),
                    substituent.getName());
        }

        NumberingEngine.Result result = engine.choose(parent.getCandidateNumberings(), features);
        Numbering numbering = result.getNumbering();
        ParentStructure numbered = parent.withNumbering(numbering);

        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : context.getGroups())
        {
            if(group.isPrincipal())
            {
                int anchor = ParentSelector.anchorOf(context.getMolecule(), group, numbered);
                group = group.withLocants(Collections.singletonList(numbering.getLocant(anchor)));
            }

            groups.add(group);
        }

        NamingContext.Builder builder = context.withStateUpdate().parent(numbered).groups(groups);
        builder.trace(trace("numbering " + numbering + " out of " + parent.getCandidateNumberings().size()
                + " candidates, decided by criterion " + result.getCriterion(), numbered.getAtomSet()));

        if(result.isAmbiguous())
            builder.warning(warning(NamingWarning.Type.AMBIGUOUS_NUMBERING,
                    "numberings of different names remained tied, atom order decided"));

        List<FunctionalGroup> esters = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup ester : context.getEsters())
            for(FunctionalGroup group : groups)
                if(group.getCarbon() == ester.getCarbon() && group.getType() == ester.getType())
                    esters.add(group);

        return builder.esters(esters).build();
    }
}
