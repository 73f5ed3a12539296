package org.javai.result.examples;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.result.Result;
import org.javai.result.boundary.Boundary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Demonstrates parsing JSON with ObjectMapper and validating it with result combinators.
 */
public class JsonParsingTest {

    record User(String name, int age) {}

    private Boundary boundary;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        boundary = Boundary.silent();
        objectMapper = new ObjectMapper();
    }

    @Test
    void validJson_parsesSuccessfully() {
        String json = """
            {"name": "Alice", "age": 30}
            """;

        Result<User, JsonProcessingException> result = parse(json);

        assertThat(result).isEqualTo(Result.success(new User("Alice", 30)));
    }

    @Test
    void invalidJson_returnsFailure() {
        Result<User, JsonProcessingException> result = parse("not valid json");

        assertThat(result.isFailure()).isTrue();
        assertThat(result.unwrapFailure()).isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void parsingAndValidationCompose() {
        String negativeAge = """
            {"name": "Bob", "age": -1}
            """;

        assertThat(parseAndValidate(negativeAge)).isEqualTo(Result.failure("age must not be negative: -1"));
        assertThat(parseAndValidate("{")).isEqualTo(Result.failure("malformed user"));
        assertThat(parseAndValidate("{\"name\": \"Carol\", \"age\": 41}").map(User::name))
                .isEqualTo(Result.success("Carol"));
    }

    private Result<User, JsonProcessingException> parse(String json) {
        return boundary.call("Json.parse", JsonProcessingException.class,
                () -> objectMapper.readValue(json, User.class));
    }

    private Result<User, String> parseAndValidate(String json) {
        return parse(json)
                .<String>mapFailure(e -> "malformed user")
                .andThen(user -> user.age() < 0
                        ? Result.failure("age must not be negative: " + user.age())
                        : Result.success(user));
    }
}
