package org.rostilos.labgate.cli.command;

import org.rostilos.labgate.cli.LabGateCli;
import org.rostilos.labgate.core.model.item.ItemSummary;
import org.rostilos.labgate.core.service.ItemService;
import org.rostilos.labgate.core.validation.RequestValidator;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "items",
        mixinStandardHelpOptions = true,
        description = "List issues or merge requests created in one calendar year (UTC).")
public class ItemsCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    LabGateCli parent;

    @CommandLine.Option(names = "--type", description = "issues or mr.")
    String type;

    @CommandLine.Option(names = "--year", description = "Four-digit year, e.g. 2023.")
    String year;

    @Override
    public Integer call() {
        RequestValidator.validateItemQuery(type, year);

        List<ItemSummary> items = new ItemService(parent.gitLabClient()).getItemsByYear(type, year);
        parent.printJson(items);
        return LabGateCli.EXIT_OK;
    }
}
