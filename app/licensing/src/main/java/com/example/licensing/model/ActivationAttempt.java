/*
 * どこで: Licensing ドメインモデル
 * 何を: 原子的な binding 作成 + カウンタ加算の実行結果を表す
 * なぜ: Lua スクリプトの再判定結果を Service へ型付きで渡すため
 */
package com.example.licensing.model;

public record ActivationAttempt(BindingOutcome outcome, int currentActivations) {}
