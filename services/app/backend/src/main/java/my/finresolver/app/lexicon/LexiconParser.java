package my.finresolver.app.lexicon;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.dataformat.yaml.YAMLMapper;

public class LexiconParser {
	private final ObjectMapper yamlMapper;

	public LexiconParser() {
		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public FinancialLexicon parse(String content) {
		FinancialLexicon lexicon = yamlMapper.readValue(content, FinancialLexicon.class);
		if (lexicon == null) {
			throw new IllegalArgumentException("Lexicon document is empty");
		}
		return lexicon;
	}
}
