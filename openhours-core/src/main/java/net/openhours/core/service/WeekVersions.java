package net.openhours.core.service;

import net.openhours.core.bits.DayBits;
import net.openhours.core.model.WeekBits;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 주간 버전 토큰 = SHA-256(월..일 순서의 6바이트 payload 7개), 소문자 hex.
 * 비트만의 순수 함수: 시각/날짜/행 수정시각은 섞지 않는다.
 */
public final class WeekVersions {
    private WeekVersions() {}

    public static String compute(WeekBits week) {
        MessageDigest md = sha256();
        for (DayBits day : week.days()) {
            md.update(day.toBytes());
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /** 동시성 토큰 비교. 대소문자/앞뒤 공백 무시 */
    public static boolean matches(String token, String version) {
        return token != null && token.strip().equalsIgnoreCase(version);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
