package com.voxpop.backend.util;

/**
 * Brazilian CPF (individual taxpayer number) check-digit validation.
 */
public final class CpfValidator {

    private CpfValidator() {
    }

    public static String clean(String document) {
        return document == null ? "" : document.replaceAll("\\D", "");
    }

    public static boolean isValid(String document) {
        String cpf = clean(document);
        if (cpf.length() != 11) {
            return false;
        }
        // 000.000.000-00, 111.111.111-11 ... pass the checksum but are not issued
        if (cpf.chars().distinct().count() == 1) {
            return false;
        }
        return checkDigit(cpf, 9) == digit(cpf, 9) && checkDigit(cpf, 10) == digit(cpf, 10);
    }

    private static int checkDigit(String cpf, int length) {
        int sum = 0;
        for (int i = 0; i < length; i++) {
            sum += digit(cpf, i) * (length + 1 - i);
        }
        int rest = (sum * 10) % 11;
        return rest == 10 ? 0 : rest;
    }

    private static int digit(String cpf, int index) {
        return cpf.charAt(index) - '0';
    }
}
