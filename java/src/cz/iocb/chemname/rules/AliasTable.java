package cz.iocb.chemname.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;



/**
 * Read-only mapping of canonical identifiers to their name aliases. Aliases are kept sorted longest-first, which makes
 * the first match found by a linear scan the greedy longest match.
 */
public class AliasTable
{
    private static final Logger LOGGER = LogManager.getLogger(AliasTable.class);

    private static final Comparator<String> longestFirst = new Comparator<String>()
    {
        @Override
        public int compare(String a, String b)
        {
            return Integer.compare(b.length(), a.length());
        }
    };


    public static final class Match
    {
        private final String canonical;
        private final String alias;


        private Match(String canonical, String alias)
        {
            this.canonical = canonical;
            this.alias = alias;
        }


        public String getCanonical()
        {
            return canonical;
        }


        public String getAlias()
        {
            return alias;
        }
    }


    private final String name;
    private final Map<String, List<String>> aliases;
    private final List<String> allAliases;
    private final Map<String, String> canonicals;


    public AliasTable(String name, Map<String, List<String>> data)
    {
        this.name = name;

        Map<String, List<String>> sorted = new LinkedHashMap<String, List<String>>();
        Map<String, String> reverse = new HashMap<String, String>();
        List<String> all = new ArrayList<String>();

        for(Entry<String, List<String>> entry : data.entrySet())
        {
            List<String> list = new ArrayList<String>(entry.getValue());

            if(!isSorted(list))
            {
                LOGGER.warn("aliases of '{}' in table '{}' are not sorted longest-first, re-sorting", entry.getKey(),
                        name);
                Collections.sort(list, longestFirst);
            }

            for(String alias : list)
            {
                String previous = reverse.put(alias, entry.getKey());

                if(previous != null && !previous.equals(entry.getKey()))
                    throw new NomenclatureTablesException(
                            "alias '" + alias + "' of table '" + name + "' is not unique: " + previous);

                all.add(alias);
            }

            sorted.put(entry.getKey(), Collections.unmodifiableList(list));
        }

        Collections.sort(all, longestFirst);

        this.aliases = Collections.unmodifiableMap(sorted);
        this.allAliases = Collections.unmodifiableList(all);
        this.canonicals = reverse;
    }


    private static boolean isSorted(List<String> list)
    {
        for(int i = 1; i < list.size(); i++)
            if(list.get(i - 1).length() < list.get(i).length())
                return false;

        return true;
    }


    public String getName()
    {
        return name;
    }


    public List<String> getAliases(String canonical)
    {
        List<String> list = aliases.get(canonical);
        return list != null ? list : Collections.<String> emptyList();
    }


    /**
     * @return canonical identifier of the alias, or null
     */
    public String getCanonical(String alias)
    {
        return canonicals.get(alias);
    }


    /**
     * Finds the longest alias occurring in the text at the given offset.
     *
     * @return the match, or null if no alias starts there
     */
    public Match match(String text, int offset)
    {
        for(String alias : allAliases)
            if(text.startsWith(alias, offset))
                return new Match(canonicals.get(alias), alias);

        return null;
    }


    /**
     * Removes the longest leading alias from the text.
     */
    public String stripLeading(String text)
    {
        Match match = match(text, 0);
        return match == null ? text : text.substring(match.getAlias().length());
    }
}
