package io.mnemo.cli;

import io.mnemo.core.memory.MemoryPage;
import io.mnemo.core.memory.MemoryQuery;
import io.mnemo.core.memory.MemoryRecord;
import io.mnemo.core.memory.SortField;
import io.mnemo.core.memory.SortOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List memories matching filters, optionally ranked by a query")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    CategoryOption category = new CategoryOption();

    @Option(names = {"-u", "--user"}, description = "Filter by user id")
    String userId;

    @Option(names = {"-a", "--agent"}, description = "Filter by agent id")
    String agentId;

    @Option(names = {"-t", "--team"}, description = "Filter by team id")
    String teamId;

    @Option(names = {"--topic"}, description = "Match any of these topics, repeatable")
    List<String> topics = new ArrayList<>();

    @Option(names = {"-q", "--query"}, description = "Rank by similarity to this text")
    String query;

    @Option(names = {"-n", "--limit"}, description = "Page size")
    Integer limit;

    @Option(names = {"-p", "--page"}, description = "1-based page number, requires --limit")
    Integer page;

    @Option(names = {"--sort-by"}, description = "memory_id, user_id, agent_id, team_id, memory or updated_at")
    String sortBy;

    @Option(names = {"--sort-order"}, description = "asc or desc", defaultValue = "asc")
    String sortOrder;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryQuery memoryQuery = MemoryQuery.builder()
                .userId(userId)
                .agentId(agentId)
                .teamId(teamId)
                .topics(topics)
                .queryText(query)
                .limit(limit)
                .page(page)
                .sortBy(sortBy == null ? null : SortField.parse(sortBy))
                .sortOrder(SortOrder.parse(sortOrder))
                .build();
            MemoryPage result = context.stores().forCategory(category.resolve()).list(memoryQuery);
            for (MemoryRecord record : result.records()) {
                System.out.println(RecordFormatter.line(record));
            }
            System.out.println("Total: " + result.totalCount());
            return 0;
        } catch (Exception e) {
            System.err.println("List command failed: " + e.getMessage());
            return 1;
        }
    }
}
