/*
 * どこで: Reminder API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 失敗した管理コマンドごとに 1 つの読めるメッセージを返すため
 */
package com.occasionbell.reminder.api;

public record ApiErrorResponse(String code, String message) {}
