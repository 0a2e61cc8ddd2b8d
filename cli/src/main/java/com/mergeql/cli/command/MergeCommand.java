package com.mergeql.cli.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mergeql.core.ColumnRef;
import com.mergeql.core.FieldPolicy;
import com.mergeql.core.MergeEngine;
import com.mergeql.core.MergeMode;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.MergeResult;
import com.mergeql.core.Plugin;
import com.mergeql.core.ValueOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "merge",
        description = "Merge duplicates into a survivor and print the result as JSON",
        mixinStandardHelpOptions = true
)
public class MergeCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MergeCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private StoreOptions store;

    @Option(names = {"--type", "-t"}, required = true, description = "Entity type name")
    private String entityType;

    @Option(names = {"--survivor", "-s"}, required = true, description = "Id that remains")
    private long survivor;

    @Option(names = {"--duplicates", "-d"}, required = true, split = ",", description = "Ids merged away")
    private List<Long> duplicates;

    @Option(names = {"--mode", "-m"}, defaultValue = "orm", description = "orm or direct (default: orm)")
    private String mode;

    @Option(names = {"--policy"}, description = "Field operation, e.g. --policy amount=sum")
    private Map<String, String> policy = new LinkedHashMap<>();

    @Option(names = {"--order"}, defaultValue = "SURVIVOR_FIRST",
            description = "Value order: ${COMPLETION-CANDIDATES}")
    private ValueOrder order;

    @Option(names = {"--preserve-unlisted"}, description = "Only reconcile fields named by --policy")
    private boolean preserveUnlisted;

    @Option(names = {"--keep-duplicates"}, description = "Relink and reconcile but do not delete the duplicates")
    private boolean keepDuplicates;

    @Option(names = {"--exclude"}, description = "Referencing column left untouched, as table.column")
    private List<String> excluded = new ArrayList<>();

    @Option(names = {"--table"}, description = "Backing table, when the catalog does not know the type")
    private String table;

    @Option(names = {"--rename-type-to"}, description = "New type tag written on polymorphic side rows")
    private String renameTypeTo;

    @Override
    public Integer call() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        FieldPolicy.Builder fieldPolicy = FieldPolicy.builder()
                .order(order)
                .preserveUnlisted(preserveUnlisted);
        policy.forEach(fieldPolicy::field);

        MergeRequest.Builder request = MergeRequest.builder(entityType)
                .duplicates(duplicates)
                .survivor(survivor)
                .mode(MergeMode.fromString(mode))
                .policy(fieldPolicy.build())
                .delete(!keepDuplicates)
                .tableName(table)
                .renameTypeTo(renameTypeTo);
        excluded.forEach(column -> request.exclude(ColumnRef.parse(column)));

        Plugin plugin = store.plugin(store.registry(mapper));
        try {
            MergeEngine engine = plugin.createEngine(store.storeConfig(), store.settings(mapper));
            MergeResult result = engine.merge(request.build());
            spec.commandLine().getOut().println(mapper.writeValueAsString(result));
            if (!result.isCompleted()) {
                logger.warn("Merge refused: {}", result.message());
                return 2;
            }
            return 0;
        } finally {
            plugin.cleanUp();
        }
    }
}
