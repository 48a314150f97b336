package com.surfer.bot.imagegen;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImageArgsParserTest {

    @Test
    void plain_prompt() {
        assertThat(ImageArgsParser.parse("a surfer at sunset"))
                .isEqualTo(new ImageRequest("a surfer at sunset", null, null, null));
    }

    @Test
    void all_options_are_extracted() {
        ImageRequest r = ImageArgsParser.parse("a surfer --size 768 at sunset --seed 42 --no people, boats");

        assertThat(r.prompt()).isEqualTo("a surfer at sunset");
        assertThat(r.size()).isEqualTo("768");
        assertThat(r.seed()).isEqualTo(42);
        assertThat(r.negative()).isEqualTo("people, boats");
    }

    @Test
    void negative_runs_to_end_of_line_after_other_options_are_removed() {
        ImageRequest r = ImageArgsParser.parse("cat --no blur --size 512");

        assertThat(r.size()).isEqualTo("512");
        assertThat(r.negative()).isEqualTo("blur");
        assertThat(r.prompt()).isEqualTo("cat");
    }

    @Test
    void unsupported_size_stays_in_prompt() {
        ImageRequest r = ImageArgsParser.parse("cat --size 2048");

        assertThat(r.size()).isNull();
        assertThat(r.prompt()).isEqualTo("cat --size 2048");
    }

    @Test
    void empty_input() {
        assertThat(ImageArgsParser.parse(null).prompt()).isEmpty();
        assertThat(ImageArgsParser.parse("--seed 3").prompt()).isEmpty();
    }
}
