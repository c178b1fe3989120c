package com.example.matching.api;

/** 認証済みユーザーの識別子を運ぶヘッダ。上流の認証ミドルウェアが付与する。 */
public final class UserIdHeader {

  public static final String NAME = "X-User-Id";

  private UserIdHeader() {}
}
