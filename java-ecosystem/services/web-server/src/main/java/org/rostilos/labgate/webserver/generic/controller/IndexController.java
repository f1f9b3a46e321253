package org.rostilos.labgate.webserver.generic.controller;

import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@CrossOrigin(origins = "*", maxAge = 3600)
@RestController
public class IndexController {

    public static final String SERVICE_NAME = "LabGate";

    @GetMapping("/")
    public Map<String, Object> index() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /permission", "Grant or change a user's role on a group or project. "
                + "JSON body: {\"username\", \"target\", \"role\"}; role is one of guest, reporter, developer, maintainer, owner");
        endpoints.put("GET /items?type=&year=", "List issues (type=issues) or merge requests (type=mr) created in the given year");
        endpoints.put("GET /health", "Liveness check");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("endpoints", endpoints);
        return response;
    }
}
