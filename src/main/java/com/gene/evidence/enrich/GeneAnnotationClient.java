package com.gene.evidence.enrich;

/**
 * Lookups against public gene annotation services.
 *
 * <p>A blank identifier yields the empty value without a call. Any other failure is
 * reported as {@link UpstreamFetchException} once retries are exhausted.</p>
 */
public interface GeneAnnotationClient {

    String SERVICE_NCBI_GENE = "ncbi-gene";
    String SERVICE_PUBMED = "pubmed";
    String SERVICE_UNIPROT = "uniprot";

    /**
     * NCBI Gene summary text for a gene id.
     */
    String geneSummary(String ncbiId);

    /**
     * Number of PubMed articles mentioning the symbol in a craniofacial or neural crest context.
     */
    int craniofacialPublicationCount(String symbol);

    /**
     * First UniProt FUNCTION comment for an accession.
     */
    String proteinFunction(String uniprotId);
}
