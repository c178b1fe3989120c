package com.example.matching.model;

/** createIfAbsent の結果。created は今回の呼び出しで行を作成した場合のみ true。 */
public record MatchCreation(MatchRecord match, boolean created) {}
