package wikigate.core.model.content;

public record TrendingArticle(String article, long views, int rank) {}
