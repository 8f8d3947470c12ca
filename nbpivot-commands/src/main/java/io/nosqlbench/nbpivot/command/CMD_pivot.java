package io.nosqlbench.nbpivot.command;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.nbpivot.PivotTable;
import io.nosqlbench.nbpivot.command.common.ColumnAssignment;
import io.nosqlbench.nbpivot.command.common.OutputFormat;
import io.nosqlbench.nbpivot.command.common.VerbosityOption;
import io.nosqlbench.nbpivot.command.input.DelimitedTableReader;
import io.nosqlbench.nbpivot.command.output.JsonTableWriter;
import io.nosqlbench.nbpivot.command.output.TextTableRenderer;
import io.nosqlbench.nbpivot.config.PivotConfigurationException;
import io.nosqlbench.nbpivot.config.PivotOptions;
import io.nosqlbench.nbpivot.status.eventing.StatusSink;
import io.nosqlbench.nbpivot.status.sinks.LoggerStatusSink;
import io.nosqlbench.nbpivot.status.sinks.NoopStatusSink;
import io.nosqlbench.nbpivot.table.Column;
import io.nosqlbench.nbpivot.table.ColumnType;
import io.nosqlbench.nbpivot.table.InMemoryTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/// Build a pivot table from a delimited text file
///
/// Rows are grouped by the `-g` columns. A numeric group-by column is binned into ranges, and
/// at most one may be, unless `--no-binning` is given. The distinct values of each `-p` column
/// become columns holding, per group, the aggregates of the rows with that value. Columns are
/// aggregated with `-a column=agg[,agg...]`; when none are, pivot values are counted.
///
/// Exit codes: 0 on success, 1 when the input cannot be read or loading fails, 2 for invalid
/// pivot settings.
@CommandLine.Command(name = "pivot",
    header = "Group and pivot rows of a delimited text file",
    description = "Group rows by the --group-by columns and summarize them by the values of the --pivot columns",
    mixinStandardHelpOptions = true)
public class CMD_pivot implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_pivot.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIG = 2;

    @CommandLine.Option(names = {"-i", "--input"}, required = true,
        description = "Delimited text file with a header line")
    private Path input;

    @CommandLine.Option(names = {"-g", "--group-by"}, split = ",",
        description = "Columns whose values, or numeric ranges, become rows")
    private List<String> groupBy = new ArrayList<>();

    @CommandLine.Option(names = {"-p", "--pivot"}, split = ",",
        description = "Columns whose distinct values become columns")
    private List<String> pivot = new ArrayList<>();

    @CommandLine.Option(names = {"-a", "--aggregate"}, converter = ColumnAssignment.Converter.class,
        description = "Aggregate a column, as column=agg[,agg...]; see the aggregators command")
    private List<ColumnAssignment> aggregates = new ArrayList<>();

    @CommandLine.Option(names = {"-t", "--type"}, converter = ColumnAssignment.Converter.class,
        description = "Set a column type instead of inferring it, as column=type (any, string, int, float, date, length)")
    private List<ColumnAssignment> types = new ArrayList<>();

    @CommandLine.Option(names = {"--bins"},
        description = "Number of bins for the numeric group-by column (default: square root of the row count)")
    private Integer bins;

    @CommandLine.Option(names = {"--threads"},
        description = "Threads used to load the pivot (default: 2)")
    private Integer threads;

    @CommandLine.Option(names = {"--no-binning"},
        description = "Group numeric columns by exact value instead of by range")
    private boolean noBinning = false;

    @CommandLine.Option(names = {"--config"},
        description = "YAML file with pivot options; command line flags take precedence")
    private Path config;

    @CommandLine.Option(names = {"--format"}, converter = OutputFormat.Converter.class, defaultValue = "text",
        description = "Output format: text or json (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.TEXT;

    @CommandLine.Option(names = {"-d", "--delimiter"},
        description = "Field delimiter (default: tab for .tsv files, comma otherwise)")
    private Character delimiter;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosityOption.apply();
            PivotOptions options = options();
            InMemoryTable table = readInput();
            PivotTable<Map<String, Object>> pivotTable = PivotTable.builder(table)
                .groupBy(columns(table, groupBy))
                .pivot(columns(table, pivot))
                .options(options)
                .sinks(progressSinks())
                .build();
            pivotTable.load().join();
            render(pivotTable, System.out);
            return EXIT_SUCCESS;
        } catch (PivotConfigurationException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid pivot settings: {}", e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            logger.error("Unable to read {}: {}", input, e.getMessage());
            return EXIT_ERROR;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Pivot of {} failed: {}", input, cause.getMessage(), cause);
            return EXIT_ERROR;
        }
    }

    private PivotOptions options() {
        PivotOptions options = config != null ? PivotOptions.load(config) : PivotOptions.DEFAULTS;
        if (bins != null) {
            if (bins < 1) {
                throw new PivotConfigurationException("--bins must be at least 1, got " + bins);
            }
            options = options.withHistogramBins(bins);
        }
        if (threads != null) {
            options = options.withThreads(threads);
        }
        if (noBinning) {
            options = options.withNumericBinning(false);
        }
        return options;
    }

    private InMemoryTable readInput() throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IOException("input file does not exist");
        }
        char separator = delimiter != null ? delimiter : DelimitedTableReader.defaultDelimiter(input);
        DelimitedTableReader reader = new DelimitedTableReader(separator);
        for (ColumnAssignment type : types) {
            reader.withType(type.column(), columnType(type));
        }
        for (ColumnAssignment aggregate : aggregates) {
            reader.withAggregators(aggregate.column(), aggregate.values());
        }
        return reader.read(input);
    }

    private static ColumnType columnType(ColumnAssignment assignment) {
        if (assignment.values().size() != 1) {
            throw new PivotConfigurationException("column '" + assignment.column() + "' needs exactly one type");
        }
        String name = assignment.values().get(0);
        try {
            return ColumnType.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PivotConfigurationException("unknown column type '" + name + "' for column '"
                + assignment.column() + "'", e);
        }
    }

    private static List<Column<Map<String, Object>>> columns(InMemoryTable table, List<String> names) {
        List<Column<Map<String, Object>>> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(table.column(name.trim()));
        }
        return columns;
    }

    List<StatusSink> progressSinks() {
        if (verbosityOption.isVerbose()) {
            return List.of(new LoggerStatusSink());
        }
        return List.of(NoopStatusSink.getInstance());
    }

    private void render(PivotTable<Map<String, Object>> pivotTable, PrintStream out) {
        switch (format) {
            case JSON:
                new JsonTableWriter().write(pivotTable, out);
                break;
            case TEXT:
            default:
                new TextTableRenderer().render(pivotTable, out);
                break;
        }
        out.flush();
    }
}
