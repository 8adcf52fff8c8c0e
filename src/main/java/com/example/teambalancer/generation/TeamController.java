package com.example.teambalancer.generation;

import com.example.teambalancer.common.ApiResponse;
import com.example.teambalancer.export.TeamCsvExporter;
import com.example.teambalancer.export.TeamTextExporter;
import com.example.teambalancer.generation.TeamGenerationRequest.MemberPayload;
import com.example.teambalancer.roster.Member;
import com.example.teambalancer.roster.NameNormalizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/teams")
public class TeamController {

    private final TeamGenerationService generationService;
    private final TeamTextExporter textExporter;
    private final TeamCsvExporter csvExporter;
    private final NameNormalizer nameNormalizer;

    public TeamController(TeamGenerationService generationService,
                          TeamTextExporter textExporter,
                          TeamCsvExporter csvExporter,
                          NameNormalizer nameNormalizer) {
        this.generationService = generationService;
        this.textExporter = textExporter;
        this.csvExporter = csvExporter;
        this.nameNormalizer = nameNormalizer;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<TeamsView>> generate(@Valid @RequestBody TeamGenerationRequest request) {
        GenerationResult result = generationService.generate(request.toGenerationRequest(),
                request.maxAttempts(), request.seed());

        Map<String, Object> meta = new HashMap<>();
        meta.put("attemptsUsed", result.attemptsUsed());
        if (result instanceof GenerationResult.Success success) {
            meta.put("attemptsRun", success.attemptsRun());
            meta.put("quality", success.quality());
            return ResponseEntity.ok(ApiResponse.success("チームを生成しました",
                    TeamsView.from(success.teams(), textExporter), meta));
        }
        GenerationResult.Failure failure = (GenerationResult.Failure) result;
        meta.put("errorKind", failure.errorKind().name());
        meta.put("errorCategory", failure.errorKind().getCategory().name());
        meta.put("suggestion", failure.suggestion());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.failure(failure.message(), meta));
    }

    @PostMapping("/export/text")
    public ResponseEntity<byte[]> exportText(@Valid @RequestBody TeamExportRequest request) {
        byte[] body = textExporter.format(toMembers(request)).getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition("teams.txt"))
                .contentType(MediaType.parseMediaType("text/plain; charset=UTF-8"))
                .body(body);
    }

    @PostMapping("/export/csv")
    public ResponseEntity<byte[]> exportCsv(@Valid @RequestBody TeamExportRequest request) {
        TeamCsvExporter.CsvFile csvFile = csvExporter.export(toMembers(request), "teams.csv");
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition(csvFile.filename()))
                .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                .body(csvFile.data());
    }

    private List<List<Member>> toMembers(TeamExportRequest request) {
        return request.teams().stream()
                .map(team -> team.stream()
                        .map(MemberPayload::toRawMember)
                        .map(raw -> new Member(nameNormalizer.normalize(raw.name()), nameNormalizer.clean(raw.name()),
                                raw.level(), raw.category(), true))
                        .toList())
                .toList();
    }

    private String disposition(String filename) {
        String encoded = UriUtils.encode(filename, StandardCharsets.UTF_8);
        return "attachment; filename=\"" + filename + "\"; filename*=UTF-8''" + encoded;
    }

    public record TeamExportRequest(
            @NotEmpty(message = "チームは1つ以上必要です")
            List<List<@Valid MemberPayload>> teams) { }
}
