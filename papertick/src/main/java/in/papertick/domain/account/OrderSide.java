package in.papertick.domain.account;

public enum OrderSide {
    BUY,
    SELL
}
