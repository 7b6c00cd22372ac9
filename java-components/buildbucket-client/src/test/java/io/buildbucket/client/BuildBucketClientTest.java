package io.buildbucket.client;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.buildbucket.client.auth.AccessToken;
import io.buildbucket.client.auth.AccessTokenProvider;
import io.buildbucket.client.auth.TokenAcquisitionException;
import io.buildbucket.client.dto.BatchRequest;
import io.buildbucket.client.dto.BatchResponse;
import io.buildbucket.client.dto.Build;
import io.buildbucket.client.dto.BuildBucketRequest;
import io.buildbucket.client.dto.BuildPredicate;
import io.buildbucket.client.dto.BuilderId;
import io.buildbucket.client.dto.CancelBuildRequest;
import io.buildbucket.client.dto.GetBuildRequest;
import io.buildbucket.client.dto.ScheduleBuildRequest;
import io.buildbucket.client.dto.SearchBuildsRequest;
import io.buildbucket.client.dto.SearchBuildsResponse;
import io.buildbucket.client.dto.Status;
import io.buildbucket.client.dto.StringPair;
import io.buildbucket.client.dto.Trinary;
import io.buildbucket.client.json.BuildBucketJson;

@ExtendWith(MockitoExtension.class)
public class BuildBucketClientTest {

    private static final String BASE_URI = "https://localhost";
    private static final ObjectMapper MAPPER = BuildBucketJson.createObjectMapper();

    private static final BuilderId BUILDER_ID = new BuilderId("flutter", "prod", "Linux");

    @Mock
    AccessTokenProvider accessTokenProvider;

    private BuildBucketClient client(RecordingTransport transport) {
        return new BuildBucketClient(BuildBucketClientConfig.builder().uri(BASE_URI).build(), transport,
                accessTokenProvider);
    }

    private void stubToken() {
        when(accessTokenProvider.createAccessToken(any(), any()))
                .thenReturn(new AccessToken("Bearer", "data", Instant.parse("2119-01-01T00:00:00Z")));
    }

    /**
     * Runs a successful call and checks everything that must hold for any method: target, headers and body.
     */
    private <T> T httpTest(BuildBucketRequest request, String response, String expectedPath,
            Function<BuildBucketClient, T> call) throws JsonProcessingException {
        stubToken();
        RecordingTransport transport = new RecordingTransport(202, response);
        T result = call.apply(client(transport));

        RecordingTransport.Call sent = transport.onlyCall();
        Assertions.assertEquals(URI.create(BASE_URI + "/" + expectedPath), sent.uri());
        Assertions.assertEquals("application/json", sent.headers().get("content-type"));
        Assertions.assertEquals("application/json", sent.headers().get("accept"));
        Assertions.assertEquals("Bearer data", sent.headers().get("authorization"));
        Assertions.assertEquals(MAPPER.writeValueAsString(request), sent.body());
        return result;
    }

    @Test
    void throwsOnNonSuccessStatus() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(403, "Error");

        BuildBucketException ex = Assertions.assertThrows(BuildBucketException.class,
                () -> client(transport).batch(new BatchRequest(List.of())));

        Assertions.assertEquals(403, ex.getStatusCode());
        Assertions.assertEquals("Error", ex.getMessage());
        Assertions.assertEquals(URI.create("https://localhost/Batch"), transport.onlyCall().uri());
    }

    @Test
    void errorBodyIsNotParsed() {
        stubToken();
        String body = Fixtures.response("build.json");
        RecordingTransport transport = new RecordingTransport(500, body);

        BuildBucketException ex = Assertions.assertThrows(BuildBucketException.class,
                () -> client(transport).getBuild(GetBuildRequest.builder().id(1L).build()));

        Assertions.assertEquals(500, ex.getStatusCode());
        Assertions.assertEquals(body, ex.getMessage());
    }

    @Test
    void scheduleBuild() throws Exception {
        Map<String, List<String>> tags = new LinkedHashMap<>();
        tags.put("user_agent", List.of("flutter_cocoon"));
        tags.put("flutter_pr", List.of("true", "1"));
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("git_url", "https://github.com/flutter/flutter");
        properties.put("git_ref", "pull/1/head");
        ScheduleBuildRequest request = ScheduleBuildRequest.builder()
                .builderId(BUILDER_ID)
                .experimental(Trinary.YES)
                .tags(StringPair.fromMap(tags))
                .properties(properties)
                .build();

        Build build = httpTest(request, Fixtures.response("build.json"), "ScheduleBuild",
                c -> c.scheduleBuild(request));

        Assertions.assertEquals(123L, build.id());
        Assertions.assertEquals(2, build.tags().size());
    }

    @Test
    void cancelBuild() throws Exception {
        CancelBuildRequest request = CancelBuildRequest.builder()
                .id(1234L)
                .summaryMarkdown("Because I felt like it.")
                .build();

        Build build = httpTest(request, Fixtures.response("build.json"), "CancelBuild",
                c -> c.cancelBuild(request));

        Assertions.assertEquals(123L, build.id());
        Assertions.assertEquals(2, build.tags().size());
    }

    @Test
    void getBuild() throws Exception {
        GetBuildRequest request = GetBuildRequest.builder().id(1234L).build();

        Build build = httpTest(request, Fixtures.response("build.json"), "GetBuild", c -> c.getBuild(request));

        Assertions.assertEquals(123L, build.id());
        Assertions.assertEquals(Status.SCHEDULED, build.status());
        Assertions.assertEquals(BUILDER_ID, build.builderId());
        Assertions.assertEquals(321, build.number());
        Assertions.assertEquals("cocoon@cocoon", build.createdBy());
        Assertions.assertNull(build.canceledBy());
        Assertions.assertNull(build.endTime());
        Assertions.assertEquals(Instant.parse("2019-08-01T11:00:00Z"), build.startTime());
        Assertions.assertEquals(Trinary.YES, build.input().experimental());
        Assertions.assertEquals(new StringPair("user_agent", "flutter_cocoon"), build.tags().get(0));
        Assertions.assertEquals(2, build.tags().size());
    }

    @Test
    void searchBuilds() throws Exception {
        SearchBuildsRequest request = SearchBuildsRequest.builder()
                .predicate(BuildPredicate.builder()
                        .tags(List.of(new StringPair("flutter_pr", "1")))
                        .build())
                .build();

        SearchBuildsResponse response = httpTest(request, Fixtures.response("search.json"), "SearchBuilds",
                c -> c.searchBuilds(request));

        Assertions.assertEquals(1, response.builds().size());
        Build build = response.builds().get(0);
        Assertions.assertEquals(9151, build.number());
        Assertions.assertEquals(8906840690092270320L, build.id());
        Assertions.assertEquals(Status.SUCCESS, build.status());
        Assertions.assertEquals("3068fc4f7c78599ab4a09b096f0672e8510fc7e6", build.input().gitilesCommit().id());
        Assertions.assertNull(response.nextPageToken());
    }

    @Test
    void batch() throws Exception {
        BatchRequest request = BatchRequest.of(GetBuildRequest.builder()
                .builderId(BUILDER_ID)
                .buildNumber(123)
                .build());

        BatchResponse response = httpTest(request, Fixtures.response("batch.json"), "Batch", c -> c.batch(request));

        Assertions.assertEquals(1, response.responses().size());
        Assertions.assertEquals(Status.SUCCESS, response.responses().get(0).getBuild().status());
    }

    @Test
    void batchReturnsItemErrorsAsDecoded() throws Exception {
        BatchRequest request = BatchRequest.of(
                GetBuildRequest.builder().id(8907827286280251904L).build(),
                GetBuildRequest.builder().id(1L).build());

        BatchResponse response = httpTest(request, Fixtures.response("batch-partial.json"), "Batch",
                c -> c.batch(request));

        Assertions.assertEquals(2, response.responses().size());
        Assertions.assertFalse(response.responses().get(0).hasError());
        Assertions.assertTrue(response.responses().get(1).hasError());
        Assertions.assertEquals(5, response.responses().get(1).error().code());
        Assertions.assertEquals("build 1 not found", response.responses().get(1).error().message());
    }

    @Test
    void targetIsPlainJoinOfUriAndMethod() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200, Fixtures.response("search.json"));
        BuildBucketClient client = new BuildBucketClient(
                BuildBucketClientConfig.builder().uri("https://localhost/prpc/buildbucket.v2.Builds/").build(),
                transport, accessTokenProvider);

        client.invoke(RpcMethod.SEARCH_BUILDS, SearchBuildsRequest.builder().pageSize(1).build());

        // no trailing slash normalization
        Assertions.assertEquals(URI.create("https://localhost/prpc/buildbucket.v2.Builds//SearchBuilds"),
                transport.onlyCall().uri());
    }

    @Test
    void passesConfiguredScopesAndServiceAccount() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200, Fixtures.response("build.json"));
        BuildBucketClientConfig config = BuildBucketClientConfig.builder()
                .uri(BASE_URI)
                .scopes(List.of("scope-a", "scope-b"))
                .serviceAccountJson("{\"client_email\":\"bot@example.com\"}")
                .build();

        new BuildBucketClient(config, transport, accessTokenProvider).getBuild(GetBuildRequest.builder().id(1L).build());

        verify(accessTokenProvider).createAccessToken("{\"client_email\":\"bot@example.com\"}",
                List.of("scope-a", "scope-b"));
    }

    @Test
    void usesDefaultScopes() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200, Fixtures.response("build.json"));

        client(transport).getBuild(GetBuildRequest.builder().id(1L).build());

        verify(accessTokenProvider).createAccessToken(null,
                List.of("https://www.googleapis.com/auth/userinfo.email"));
    }

    @Test
    void tokenFailureIsPropagatedUnchanged() {
        TokenAcquisitionException failure = new TokenAcquisitionException("no credentials");
        when(accessTokenProvider.createAccessToken(any(), any())).thenThrow(failure);
        RecordingTransport transport = new RecordingTransport(200, Fixtures.response("build.json"));

        TokenAcquisitionException thrown = Assertions.assertThrows(TokenAcquisitionException.class,
                () -> client(transport).getBuild(GetBuildRequest.builder().id(1L).build()));

        Assertions.assertSame(failure, thrown);
        Assertions.assertTrue(transport.calls.isEmpty());
    }

    @Test
    void missingPreambleFailsToDecode() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200, Fixtures.load("build.json"));

        BuildBucketDecodeException ex = Assertions.assertThrows(BuildBucketDecodeException.class,
                () -> client(transport).getBuild(GetBuildRequest.builder().id(1L).build()));

        Assertions.assertTrue(ex.getMessage().contains("GetBuild"), ex.getMessage());
        Assertions.assertNull(ex.getCause());
        Assertions.assertSame(RpcMethod.GET_BUILD, ex.getMethod());
    }

    @Test
    void malformedJsonFailsToDecode() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200,
                BuildBucketClient.RPC_RESPONSE_PREAMBLE + "{\"id\": ");

        BuildBucketDecodeException ex = Assertions.assertThrows(BuildBucketDecodeException.class,
                () -> client(transport).getBuild(GetBuildRequest.builder().id(1L).build()));

        Assertions.assertInstanceOf(JsonProcessingException.class, ex.getCause());
        Assertions.assertSame(RpcMethod.GET_BUILD, ex.getMethod());
    }

    @Test
    void schemaMismatchFailsToDecode() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200,
                BuildBucketClient.RPC_RESPONSE_PREAMBLE + "{\"builds\": \"not a list\"}");

        BuildBucketDecodeException ex = Assertions.assertThrows(BuildBucketDecodeException.class,
                () -> client(transport).searchBuilds(SearchBuildsRequest.builder().build()));

        Assertions.assertSame(RpcMethod.SEARCH_BUILDS, ex.getMethod());
    }

    @Test
    void emptyPayloadFailsToDecode() {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200, BuildBucketClient.RPC_RESPONSE_PREAMBLE);

        Assertions.assertThrows(BuildBucketDecodeException.class,
                () -> client(transport).getBuild(GetBuildRequest.builder().id(1L).build()));
    }

    @Test
    void transportFailureIsWrapped() {
        stubToken();
        IOException failure = new IOException("connection reset");
        BuildBucketClient client = new BuildBucketClient(BuildBucketClientConfig.builder().uri(BASE_URI).build(),
                (uri, headers, body) -> {
                    throw failure;
                }, accessTokenProvider);

        UncheckedIOException ex = Assertions.assertThrows(UncheckedIOException.class,
                () -> client.getBuild(GetBuildRequest.builder().id(1L).build()));

        Assertions.assertSame(failure, ex.getCause());
    }

    @Test
    void concurrentCallsAreIndependent() throws Exception {
        stubToken();
        RecordingTransport transport = new RecordingTransport(200, Fixtures.response("build.json"));
        BuildBucketClient client = client(transport);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Build>> futures = new ArrayList<>();
            for (long i = 0; i < 16; i++) {
                GetBuildRequest request = GetBuildRequest.builder().id(i).build();
                futures.add(executor.submit(() -> client.getBuild(request)));
            }
            for (Future<Build> future : futures) {
                Assertions.assertEquals(123L, future.get().id());
            }
        } finally {
            executor.shutdownNow();
        }
        Assertions.assertEquals(16, transport.calls.size());
        for (RecordingTransport.Call call : transport.calls) {
            Assertions.assertEquals(URI.create("https://localhost/GetBuild"), call.uri());
            Assertions.assertEquals("Bearer data", call.headers().get("authorization"));
        }
    }
}
