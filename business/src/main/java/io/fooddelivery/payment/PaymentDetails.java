package io.fooddelivery.payment;

public record PaymentDetails(String cardNumber, String expiryDate, String cvv) {

    private static final PaymentDetails NONE = new PaymentDetails(null, null, null);

    public static PaymentDetails none() {
        return NONE;
    }

    public static PaymentDetails card(String cardNumber, String expiryDate, String cvv) {
        return new PaymentDetails(cardNumber, expiryDate, cvv);
    }

    public String maskedCardNumber() {
        return CardNumbers.mask(cardNumber);
    }

    @Override
    public String toString() {
        return "PaymentDetails[cardNumber=" + maskedCardNumber() + ", expiryDate=" + expiryDate + "]";
    }
}
