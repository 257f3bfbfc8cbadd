package com.gene.evidence.genome;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;

/**
 * CSV export of the genome-wide table.
 *
 * <pre>
 * symbol,name,ncbi_id,uniprot_id,ensembl_id,omim_id,location,in_hpo,hpo_phenotype_count,...
 * BMP4,bone morphogenetic protein 4,652,P12644,ENSG00000125378,112262,14q22.2,true,120,...
 * </pre>
 */
public class GenomeWideCsvExporter {

    static final String HEADER = "symbol,name,ncbi_id,uniprot_id,ensembl_id,omim_id,location,"
            + "in_hpo,hpo_phenotype_count,in_orphanet,orphanet_disorder_count,in_omim,omim_title,"
            + "omim_syndrome_count,in_curated,curated_source_count,hgnc_source";

    /**
     * Writes the header and one line per row. The writer is flushed, not closed.
     */
    public int export(List<GenomeWideRow> rows, Writer writer) throws IOException {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        pw.println(HEADER);
        for (GenomeWideRow row : rows) {
            pw.println(String.join(",",
                    csvEscape(row.symbol()),
                    csvEscape(row.name()),
                    csvEscape(row.ncbiId()),
                    csvEscape(row.uniprotId()),
                    csvEscape(row.ensemblId()),
                    csvEscape(row.omimId()),
                    csvEscape(row.location()),
                    Boolean.toString(row.inHpo()),
                    Integer.toString(row.hpoPhenotypeCount()),
                    Boolean.toString(row.inOrphanet()),
                    Integer.toString(row.orphanetDisorderCount()),
                    Boolean.toString(row.inOmim()),
                    csvEscape(row.omimTitle()),
                    Integer.toString(row.omimSyndromeCount()),
                    Boolean.toString(row.inCurated()),
                    Integer.toString(row.curatedSourceCount()),
                    csvEscape(row.hgncSource())));
        }
        pw.flush();
        if (pw.checkError()) {
            throw new IOException("Failed to write genome-wide CSV");
        }
        return rows.size();
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
