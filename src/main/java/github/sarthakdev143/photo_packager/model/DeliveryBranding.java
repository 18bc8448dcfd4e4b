package github.sarthakdev143.photo_packager.model;

public record DeliveryBranding(String companyName, String website, String supportEmail) {

    public DeliveryBranding {
        companyName = companyName == null ? "" : companyName.trim();
        website = website == null ? "" : website.trim();
        supportEmail = supportEmail == null ? "" : supportEmail.trim();
    }

    public static DeliveryBranding none() {
        return new DeliveryBranding("", "", "");
    }
}
