package dtm.hexdi.export;

public record ExportedEdge(String from, String to) {
}
