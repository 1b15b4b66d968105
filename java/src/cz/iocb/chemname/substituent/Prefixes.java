package cz.iocb.chemname.substituent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.numbering.Locant;
import cz.iocb.chemname.rules.NomenclatureTables;



/**
 * Merges identical substituents, orders them alphanumerically and renders the prefix part of a name (P-14.4, P-16.9).
 */
public class Prefixes
{
    private static final Comparator<PrefixGroup> order = new Comparator<PrefixGroup>()
    {
        @Override
        public int compare(PrefixGroup a, PrefixGroup b)
        {
            int result = a.getKey().compareTo(b.getKey());

            if(result != 0)
                return result;

            if(!a.getLocants().isEmpty() && !b.getLocants().isEmpty())
            {
                result = a.getLocants().get(0).compareTo(b.getLocants().get(0));

                if(result != 0)
                    return result;
            }

            return a.getName().compareTo(b.getName());
        }
    };


    /**
     * @param substituents substituents with assigned locants
     * @return prefix groups in citation order
     */
    public static List<PrefixGroup> merge(List<Substituent> substituents, NomenclatureTables tables)
    {
        Map<String, List<Locant>> locants = new LinkedHashMap<String, List<Locant>>();
        Map<String, Boolean> compound = new LinkedHashMap<String, Boolean>();

        for(Substituent substituent : substituents)
        {
            List<Locant> list = locants.get(substituent.getName());

            if(list == null)
            {
                list = new ArrayList<Locant>();
                locants.put(substituent.getName(), list);
                compound.put(substituent.getName(), substituent.isCompound());
            }

            list.add(substituent.getLocant());
        }

        List<PrefixGroup> groups = new ArrayList<PrefixGroup>();

        for(Map.Entry<String, List<Locant>> entry : locants.entrySet())
        {
            String name = entry.getKey();
            boolean isCompound = compound.get(name);
            List<Locant> list = entry.getValue();

            String text = multiplier(list.size(), isCompound, tables) + enclosed(name, isCompound);

            if(list.size() > 1)
                text = tables.getMultiplierAliases().stripLeading(text);

            groups.add(new PrefixGroup(name, isCompound, list, key(text)));
        }

        Collections.sort(groups, order);
        return groups;
    }


    /**
     * @param omitLocants whether the locants are implied by the parent ("chlorobenzene")
     */
    public static String render(List<PrefixGroup> groups, boolean omitLocants, NomenclatureTables tables)
    {
        StringBuilder builder = new StringBuilder();

        for(PrefixGroup group : groups)
        {
            String text = multiplier(group.getCount(), group.isCompound(), tables)
                    + enclosed(group.getName(), group.isCompound());

            if(omitLocants)
            {
                if(builder.length() > 0 && !isEnclosed(text))
                    text = enclose(text);
            }
            else
            {
                if(builder.length() > 0)
                    builder.append('-');

                builder.append(Locant.join(group.getLocants())).append('-');
            }

            builder.append(text);
        }

        return builder.toString();
    }


    /**
     * Appends the parent name to the prefixes, separating a leading locant by a hyphen.
     */
    public static String prepend(String prefixes, String name)
    {
        if(prefixes.isEmpty())
            return name;

        if(Character.isDigit(name.charAt(0)))
            return prefixes + "-" + name;

        return prefixes + name;
    }


    /**
     * Encloses the text in the next level of enclosing marks: ( ), then [ ], then { }.
     */
    public static String enclose(String text)
    {
        if(text.indexOf('[') >= 0 || text.indexOf('{') >= 0)
            return "{" + text + "}";

        if(text.indexOf('(') >= 0)
            return "[" + text + "]";

        return "(" + text + ")";
    }


    /**
     * @return whether a substituent name has to be enclosed when cited as a prefix
     */
    static boolean needsEnclosure(String name, boolean compound)
    {
        if(compound)
            return true;

        for(int i = 0; i < name.length(); i++)
            if(Character.isDigit(name.charAt(i)))
                return true;

        return false;
    }


    static String enclosed(String name, boolean compound)
    {
        return needsEnclosure(name, compound) ? enclose(name) : name;
    }


    private static boolean isEnclosed(String text)
    {
        char last = text.charAt(text.length() - 1);
        return last == ')' || last == ']' || last == '}';
    }


    private static String multiplier(int count, boolean compound, NomenclatureTables tables)
    {
        return compound ? tables.getGroupMultiplier(count) : tables.getBasicMultiplier(count);
    }


    public static String key(String text)
    {
        StringBuilder builder = new StringBuilder();

        for(int i = 0; i < text.length(); i++)
            if(Character.isLetter(text.charAt(i)))
                builder.append(Character.toLowerCase(text.charAt(i)));

        return builder.toString();
    }
}
