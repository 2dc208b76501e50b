package org.ismcore.app;

import org.ismcore.analysis.core.AnalysisResult;
import org.ismcore.analysis.core.IsmAnalyzer;
import org.ismcore.analysis.level.LevelPartition;
import org.ismcore.analysis.matrix.BinaryMatrix;
import org.ismcore.analysis.relation.SsimTable;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Command-line entry point for local smoke runs.
 *
 * <p>Usage: {@code Main A,B,C A:B:V B:C:V}. The first argument lists element identifiers;
 * each further argument states one {@code row:column:relation} judgment.</p>
 */
public class Main {
    static final String USAGE = "Usage: Main <id1,id2,...> [row:column:V|A|X|O ...]";

    /**
     * Runs one analysis and prints its levels and canonical edges.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println(USAGE);
            return;
        }

        List<String> identifiers = parseIdentifiers(args[0]);
        SsimTable.Builder table = SsimTable.builder();
        for (int i = 1; i < args.length; i++) {
            String[] parts = args[i].split(":", -1);
            if (parts.length != 3 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IllegalArgumentException("judgment must look like row:column:relation, found " + args[i]);
            }
            table.put(parts[0].trim(), parts[1].trim(), parts[2]);
        }

        AnalysisResult result = new IsmAnalyzer().analyze(identifiers.size(), identifiers, table.build());

        for (LevelPartition level : result.getLevels()) {
            StringJoiner names = new StringJoiner(", ");
            for (int element : level.elementsCopy()) {
                names.add(result.identifierAt(element));
            }
            System.out.println("Level " + level.getLevel() + ": " + names);
        }
        BinaryMatrix canonical = result.getCanonical();
        for (int i = 0; i < canonical.size(); i++) {
            for (int j = 0; j < canonical.size(); j++) {
                if (canonical.get(i, j)) {
                    System.out.println(result.identifierAt(i) + " -> " + result.identifierAt(j));
                }
            }
        }
    }

    private static List<String> parseIdentifiers(String argument) {
        List<String> identifiers = new ArrayList<>();
        for (String token : argument.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                identifiers.add(trimmed);
            }
        }
        return identifiers;
    }
}
