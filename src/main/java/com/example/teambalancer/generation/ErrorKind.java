package com.example.teambalancer.generation;

/**
 * Failure taxonomy for team generation. Every kind carries a fixed message and
 * a suggestion the user can act on.
 */
public enum ErrorKind {

    DUPLICATE_IDENTITY(Category.INPUT,
            "重複したメンバー名が見つかりました",
            "名簿から重複した名前を削除して再度お試しください。"),
    INVALID_LEVEL(Category.INPUT,
            "レベルが1〜3の範囲外のメンバーがいます",
            "該当するメンバーのレベルを1〜3に修正してください。"),
    EMPTY_ROSTER(Category.INPUT,
            "出席中のメンバーがいません",
            "チームを生成する前にメンバーを追加するか出席に設定してください。"),
    TEAM_COUNT_OUT_OF_RANGE(Category.INPUT,
            "チーム数が許容範囲外です",
            "有効なチーム数を指定して再度お試しください。"),
    TEAM_COUNT_EXCEEDS_PRESENT(Category.INPUT,
            "チーム数が出席メンバー数を超えています",
            "チーム数を減らすかメンバーを追加してください。"),
    SELF_REFERENTIAL_RULE(Category.RULE,
            "同じメンバーが両側に指定されたルールがあります",
            "無効なルールを削除して再度お試しください。"),
    UNKNOWN_IDENTITY_RULE(Category.RULE,
            "名簿に存在しないメンバーを参照するルールがあります",
            "無効なルールを整理して再度お試しください。"),
    CONTRADICTORY_RULES(Category.RULE,
            "同じチームに必須のメンバー同士が同席禁止にもなっています",
            "該当する同席禁止ルールまたは同席必須ルールのどちらかを削除してください。"),
    OVERSIZED_GROUP(Category.STRUCTURAL,
            "同席必須のグループがどのチームにも収まりません",
            "チーム数を減らすか同席必須ルールを緩和してください。"),
    TOO_FEW_GROUPS(Category.STRUCTURAL,
            "同席必須のグループがまとまりすぎて空のチームができます",
            "チーム数を減らすか同席必須ルールを減らしてください。"),
    NO_FEASIBLE_ALLOCATION(Category.SEARCH,
            "現在のルールでは有効なチーム分けを作成できませんでした",
            "チーム数を増やすか一部の同席禁止ルールを削除して再度お試しください。"),
    CANCELLED(Category.SEARCH,
            "チーム生成が中断されました",
            "時間をおいて再度お試しください。");

    public enum Category {
        INPUT,
        RULE,
        STRUCTURAL,
        SEARCH
    }

    private final Category category;
    private final String message;
    private final String suggestion;

    ErrorKind(Category category, String message, String suggestion) {
        this.category = category;
        this.message = message;
        this.suggestion = suggestion;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
