package com.vibedeutsch.backend.lexicon.match;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.lexicon.resolver")
public class ResolverProperties {

    /** 模糊比對：>= 此值直接當候選 */
    private double autoAcceptThreshold = 0.85;

    /** 模糊比對：>= 此值只當建議（did you mean） */
    private double displayThreshold = 0.30;

    /** 短字不做模糊比對（編輯距離比例在短字上不穩） */
    private int minFuzzyLength = 4;

    /** 候選長度窗 ±N 字 */
    private int lengthWindow = 2;

    private int candidateLimit = 50;

    private int maxSuggestions = 5;

    private int maxQueryLength = 100;

    /** 非德語查詢要走譯文反查，偵測信心需 >= 此值 */
    private double translationMinConfidence = 0.90;
}
