package taxon;

/**
 * A named leaf of the sampled phylogeny, identified by its dense index in a
 * {@link TaxonMap}.
 */
public final class Taxon {

    public final int id;
    public final String label;

    public Taxon(int id, String label) {
        if (id < 0) {
            throw new IllegalArgumentException("Taxon id must be non-negative, got " + id);
        }
        if (label == null) {
            throw new IllegalArgumentException("Taxon label must not be null");
        }
        this.id = id;
        this.label = label;
    }

    @Override
    public String toString(){
        return label;
    }
}
