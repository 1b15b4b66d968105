package cz.iocb.chemname.rules;

import java.util.Collections;
import java.util.List;
import com.fasterxml.jackson.annotation.JsonProperty;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Locant;



/**
 * Retained ring or ring system. The template molecule lists its atoms in locant order.
 */
public class RingTemplate
{
    @JsonProperty("name")
    private String name;

    @JsonProperty("substituent")
    private String substituent;

    @JsonProperty("smiles")
    private String smiles;

    @JsonProperty("labels")
    private List<String> labels;

    private Molecule molecule;
    private Locant[] locants;


    public String getName()
    {
        return name;
    }


    /**
     * @return retained substituent name ("phenyl"), or null when the name is formed by the "-yl" suffix
     */
    public String getSubstituent()
    {
        return substituent;
    }


    public String getSmiles()
    {
        return smiles;
    }


    public List<String> getLabels()
    {
        return labels == null ? Collections.<String> emptyList() : labels;
    }


    public Molecule getMolecule()
    {
        return molecule;
    }


    public Locant getLocant(int atom)
    {
        return locants[atom];
    }


    public int getSize()
    {
        return molecule.getAtomCount();
    }


    void initialize(Molecule molecule)
    {
        if(labels != null && labels.size() != molecule.getAtomCount())
            throw new NomenclatureTablesException("template " + name + " has " + labels.size() + " labels for "
                    + molecule.getAtomCount() + " atoms");

        this.molecule = molecule;
        this.locants = new Locant[molecule.getAtomCount()];

        for(int i = 0; i < locants.length; i++)
            locants[i] = labels == null ? Locant.of(i + 1) : Locant.parse(labels.get(i));
    }


    @Override
    public String toString()
    {
        return name;
    }
}
