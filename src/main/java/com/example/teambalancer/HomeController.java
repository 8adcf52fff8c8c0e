package com.example.teambalancer;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HomeController {

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("application", "Team Balancer");
        response.put("version", "1.0.0");
        response.put("description", "出席メンバーをルールに従って均等なチームに分けるアプリケーション");

        Map<String, String> teamEndpoints = new LinkedHashMap<>();
        teamEndpoints.put("チーム生成", "POST /api/teams/generate");
        teamEndpoints.put("テキスト出力", "POST /api/teams/export/text");
        teamEndpoints.put("CSV出力", "POST /api/teams/export/csv");

        Map<String, String> rosterEndpoints = new LinkedHashMap<>();
        rosterEndpoints.put("名簿テキスト解析", "POST /api/roster/parse");
        rosterEndpoints.put("名前リスト整理", "POST /api/roster/names");

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("teams", teamEndpoints);
        endpoints.put("roster", rosterEndpoints);
        endpoints.put("health", "GET /api/health");
        response.put("availableEndpoints", endpoints);

        response.put("note", "seedを指定すると同じ入力から同じチーム分けが得られます");
        return response;
    }
}
