package org.rostilos.labgate.webserver.item.controller;

import org.rostilos.labgate.core.model.item.ItemSummary;
import org.rostilos.labgate.core.service.ItemService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
public class ItemController {
    private final ItemService itemService;

    public ItemController(ItemService itemService) {
        this.itemService = itemService;
    }

    /**
     * Issues or merge requests created during one calendar year (UTC).
     * Both parameters are checked by {@link ItemService} so that a missing one
     * is reported with the same error body as a malformed one.
     */
    @GetMapping("/items")
    public ResponseEntity<List<ItemSummary>> getItems(
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "year", required = false) String year
    ) {
        return ResponseEntity.ok(itemService.getItemsByYear(type, year));
    }
}
