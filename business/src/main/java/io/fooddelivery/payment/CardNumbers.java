package io.fooddelivery.payment;

final class CardNumbers {

    private CardNumbers() {}

    static String mask(String cardNumber) {
        if (cardNumber == null || cardNumber.isEmpty()) return "<none>";
        if (cardNumber.length() <= 4) return "****";
        return "****" + cardNumber.substring(cardNumber.length() - 4);
    }

    static boolean passesLuhn(String cardNumber) {
        var sum = 0;
        var doubleDigit = false;
        for (var i = cardNumber.length() - 1; i >= 0; i--) {
            var c = cardNumber.charAt(i);
            if (c < '0' || c > '9') return false;
            var digit = c - '0';
            if (doubleDigit) {
                digit *= 2;
                if (digit > 9) digit -= 9;
            }
            sum += digit;
            doubleDigit = !doubleDigit;
        }
        return sum % 10 == 0;
    }
}
