package wikigate.core.model.content;

public enum CategoryMemberType {
    PAGE,
    SUBCAT,
    FILE;

    public String apiValue() {
        return name().toLowerCase();
    }
}
