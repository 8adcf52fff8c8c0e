package com.example.teambalancer.roster;

import com.example.teambalancer.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/roster")
public class RosterController {

    private static final Logger logger = LoggerFactory.getLogger(RosterController.class);

    private final RosterTextParser parser;
    private final RosterNormalizer normalizer;

    public RosterController(RosterTextParser parser, RosterNormalizer normalizer) {
        this.parser = parser;
        this.normalizer = normalizer;
    }

    // Duplicates are reported, not rejected, so the user can fix the list before generating.
    @PostMapping("/parse")
    public ResponseEntity<ApiResponse<List<RawMember>>> parse(@Valid @RequestBody RosterTextRequest request) {
        List<RawMember> parsed = parser.parse(request.text());
        RosterNormalizer.DedupeResult<Member> deduped = normalizer.dedupeMembers(parsed);
        List<RawMember> unique = deduped.unique().stream()
                .map(m -> new RawMember(m.displayName(), m.level(), m.category(), m.present()))
                .toList();
        logger.debug("名簿テキストを解析しました: {} 件 (重複 {} 件)", unique.size(), deduped.duplicates().size());
        String message = deduped.duplicates().isEmpty()
                ? "名簿を読み込みました"
                : "重複した名前を除外して名簿を読み込みました";
        return ResponseEntity.ok(ApiResponse.success(message, unique,
                Map.of("duplicates", deduped.duplicates())));
    }

    @PostMapping("/names")
    public ResponseEntity<ApiResponse<List<String>>> names(@Valid @RequestBody RosterTextRequest request) {
        RosterNormalizer.DedupeResult<String> deduped = normalizer.dedupeNames(parser.parseNameLines(request.text()));
        logger.debug("名前リストを整理しました: {} 件 (重複 {} 件)", deduped.unique().size(), deduped.duplicates().size());
        return ResponseEntity.ok(ApiResponse.success("名前リストを整理しました", deduped.unique(),
                Map.of("duplicates", deduped.duplicates())));
    }

    public record RosterTextRequest(@NotNull(message = "名簿テキストは必須です") String text) { }
}
