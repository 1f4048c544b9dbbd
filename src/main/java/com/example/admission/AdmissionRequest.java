package com.example.admission;

/**
 * 判定に必要なリクエスト情報だけを抜き出したもの。
 *
 * @param path          正規化済みの URL パス
 * @param remoteAddress 接続元アドレス (取れなければ null)
 * @param forwardedFor  信頼するプロキシヘッダの生の値 (無ければ null)
 * @param principalId   認証済みユーザーID (未認証なら null)
 */
public record AdmissionRequest(String path, String remoteAddress, String forwardedFor, String principalId) {

    public static AdmissionRequest anonymous(String path, String remoteAddress) {
        return new AdmissionRequest(path, remoteAddress, null, null);
    }

    public static AdmissionRequest authenticated(String path, String principalId) {
        return new AdmissionRequest(path, null, null, principalId);
    }
}
