package taxon;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * TaxonMap: insertion-ordered, two-way mapping between taxon labels and ids.
 *
 * One map is shared by every tree parsed from the same file, so leaves with the
 * same label carry the same id across trees. Ids are assigned densely in order
 * of first appearance and are never reused; there is no removal or renaming.
 */
public class TaxonMap {

    private final Map<String, Taxon> taxaMap;       // Label to Taxon mapping
    private final ArrayList<Taxon> taxa;            // Taxa indexed by id

    public TaxonMap() {
        this(16);
    }

    /**
     * @param expectedSize number of distinct labels expected, used for sizing
     */
    public TaxonMap(int expectedSize) {
        int capacity = Math.max(16, expectedSize);
        this.taxaMap = new HashMap<>(capacity * 4 / 3 + 1);
        this.taxa = new ArrayList<>(capacity);
    }

    /**
     * Returns the id of {@code label}, assigning the next free id if the label
     * has not been seen before.
     */
    public int getOrInsert(String label) {
        Taxon taxon = taxaMap.get(label);
        if (taxon == null) {
            taxon = new Taxon(taxa.size(), label);
            taxaMap.put(label, taxon);
            taxa.add(taxon);
        }
        return taxon.id;
    }

    /** Looks up the id of {@code label} without inserting it. */
    public OptionalInt getIndex(String label) {
        Taxon taxon = taxaMap.get(label);
        return taxon == null ? OptionalInt.empty() : OptionalInt.of(taxon.id);
    }

    public boolean contains(String label) {
        return taxaMap.containsKey(label);
    }

    /**
     * @throws IndexOutOfBoundsException if no taxon has this id
     */
    public Taxon getTaxon(int id) {
        return taxa.get(id);
    }

    public String getLabel(int id) {
        return taxa.get(id).label;
    }

    /** Number of distinct labels held. */
    public int size() {
        return taxa.size();
    }

    /** Labels in id order, as a read-only view. */
    public List<String> labels() {
        return new AbstractList<String>() {
            @Override
            public String get(int index) {
                return taxa.get(index).label;
            }

            @Override
            public int size() {
                return taxa.size();
            }
        };
    }

    @Override
    public String toString() {
        return "TaxonMap" + labels();
    }
}
