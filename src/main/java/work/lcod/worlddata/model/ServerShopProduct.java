package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ServerShopProduct {
    @JsonProperty("productId")
    private int productId;

    @JsonProperty("basePrice")
    private int basePrice;

    private ServerShopProduct() {}

    public ServerShopProduct(int productId, int basePrice) {
        this.productId = productId;
        this.basePrice = basePrice;
    }

    public int productId() {
        return productId;
    }

    public int basePrice() {
        return basePrice;
    }
}
