package dev.xcdl;

import static org.assertj.core.api.Assertions.*;

import dev.xcdl.model.Kind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ItemSpecTest {

	@Test
	void testParseMovie() {
		ItemSpec spec = ItemSpec.parse("movie:42:mkv:Some Movie: Part 2").orElseThrow();

		assertThat(spec.kind()).isEqualTo(Kind.MOVIE);
		assertThat(spec.catalogId()).isEqualTo("42");
		assertThat(spec.extension()).isEqualTo("mkv");
		assertThat(spec.title()).isEqualTo("Some Movie: Part 2");
		assertThat(spec.wholeSeries()).isFalse();
	}

	@Test
	void testParseEpisodeWithoutTitle() {
		ItemSpec spec = ItemSpec.parse("series:101:mp4").orElseThrow();

		assertThat(spec.kind()).isEqualTo(Kind.SERIES);
		assertThat(spec.title()).isNull();
	}

	@Test
	void testParseWholeSeries() {
		ItemSpec spec = ItemSpec.parse("show:7").orElseThrow();

		assertThat(spec.wholeSeries()).isTrue();
		assertThat(spec.catalogId()).isEqualTo("7");
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "movie", "movie:42", "movie::mkv", "film:42:mkv", "show:", "show:7:mkv"})
	void testParseInvalid(String value) {
		assertThat(ItemSpec.parse(value)).isEmpty();
	}
}
