package my.finresolver.app.lexicon;

public record DissectionMatch(DissectionGroupDefinition group, String indicator) {
	public long groupId() {
		return group.groupId();
	}
}
