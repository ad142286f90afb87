package com.spring.listentogether.controller;

import com.spring.listentogether.config.MusicApiProperties;
import com.spring.listentogether.domain.enums.MusicSource;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.exception.GlobalExceptionHandler;
import com.spring.listentogether.service.PlaybackService;
import com.spring.listentogether.service.PlaylistService;
import com.spring.listentogether.service.RoomService;
import com.spring.listentogether.service.music.MusicLookupService;
import com.spring.listentogether.service.room.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ListenTogetherApiTest {

    private static final String ROOM = "/api/v1/rooms/g1";

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RoomRegistry registry = new RoomRegistry();
        MusicLookupService lookup = mock(MusicLookupService.class);
        when(lookup.search(anyString(), anyInt())).thenReturn(List.of(
            new Song("185809", "稻香", "周杰伦", "魔杰座", 223, "", MusicSource.NETEASE),
            new Song("186001", "晴天", "周杰伦", "叶惠美", 269, "", MusicSource.NETEASE)
        ));
        when(lookup.resolvePlayUrl(any())).thenAnswer(inv -> {
            Song song = inv.getArgument(0);
            return song.assignPlayUrlIfAbsent("http://m701.music.126.net/" + song.getId() + ".mp3");
        });

        MusicApiProperties props = new MusicApiProperties(
            "http://qq.test/search", "http://qq.test/play",
            "http://netease.test/search", "http://netease.test/play",
            "test-agent", "", Duration.ofSeconds(10), 5, 4);

        mockMvc = MockMvcBuilders.standaloneSetup(
                new RoomController(new RoomService(registry)),
                new PlaylistController(new PlaylistService(registry, lookup, props)),
                new PlaybackController(new PlaybackService(registry, lookup)),
                new HelpController())
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private ResultActions as(String userId, MockHttpServletRequestBuilder request) throws Exception {
        return mockMvc.perform(request.header("X-User-Id", userId).header("X-User-Name", userId + "-name"));
    }

    private static MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder request, String body) {
        return request.contentType(MediaType.APPLICATION_JSON).content(body);
    }

    @Test
    void fullRoomLifecycle() throws Exception {
        as("owner", post(ROOM))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.roomId").value("room_g1"))
            .andExpect(jsonPath("$.status").value("CREATED"));

        as("m1", post(ROOM + "/members"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("JOINED"))
            .andExpect(jsonPath("$.memberCount").value(2));

        as("m1", json(post(ROOM + "/search"), "{\"keyword\":\"稻香\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.songs", hasSize(2)))
            .andExpect(jsonPath("$.songs[0].position").value(1))
            .andExpect(jsonPath("$.songs[0].display").value("🎵 稻香 - 周杰伦 [넷이즈]"));

        as("m1", json(post(ROOM + "/selection"), "{\"position\":\"1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.song.id").value("185809"))
            .andExpect(jsonPath("$.song.directStream").value(true))
            .andExpect(jsonPath("$.playlistSize").value(1));

        as("owner", post(ROOM + "/playback/play"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("STARTED"))
            .andExpect(jsonPath("$.song.playUrl").value("http://m701.music.126.net/185809.mp3"));

        mockMvc.perform(get(ROOM))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.playing").value(true))
            .andExpect(jsonPath("$.memberCount").value(2))
            .andExpect(jsonPath("$.currentSong.name").value("稻香"));

        as("m1", delete(ROOM + "/members/me"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("LEFT"));

        as("owner", delete(ROOM))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CLOSED"));

        mockMvc.perform(get(ROOM))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NO_ACTIVE_ROOM"));
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        as("owner", post(ROOM)).andExpect(status().isCreated());

        as("m1", post(ROOM))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ROOM_ALREADY_EXISTS"));

        as("owner", delete(ROOM + "/members/me"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("OWNER_CANNOT_LEAVE"));

        as("stranger", get(ROOM + "/playlist"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));

        as("owner", json(post(ROOM + "/selection"), "{\"position\":\"1\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NO_PENDING_SEARCH"));

        as("owner", post(ROOM + "/playback/next"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("EMPTY_PLAYLIST"));

        as("owner", delete(ROOM + "/playlist/3"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INDEX_OUT_OF_RANGE"));

        as("m1", post(ROOM + "/members")).andExpect(status().isOk());
        as("m1", delete(ROOM + "/playlist"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("NOT_OWNER"));
        as("m1", delete(ROOM))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("NOT_OWNER"));
    }

    @Test
    void badRequests() throws Exception {
        mockMvc.perform(post(ROOM))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        as("owner", post(ROOM)).andExpect(status().isCreated());

        as("owner", json(post(ROOM + "/search"), "{\"keyword\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        as("owner", json(post(ROOM + "/playback/jump"), "{not json"))
            .andExpect(status().isBadRequest());

        as("owner", json(post(ROOM + "/playback/jump"), "{\"position\":\"abc\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void playModeQueryAndChange() throws Exception {
        as("owner", post(ROOM)).andExpect(status().isCreated());

        as("owner", get(ROOM + "/mode"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("SEQUENTIAL"))
            .andExpect(jsonPath("$.changed").value(false));

        as("owner", json(put(ROOM + "/mode"), "{\"mode\":\"random\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("RANDOM"))
            .andExpect(jsonPath("$.changed").value(true));

        as("owner", json(put(ROOM + "/mode"), "{\"mode\":\"loop\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("RANDOM"))
            .andExpect(jsonPath("$.changed").value(false));
    }

    @Test
    void percentEncodedNameIsDecoded() throws Exception {
        mockMvc.perform(post(ROOM)
                .header("X-User-Id", "owner")
                .header("X-User-Name", "%EB%B0%A9%EC%9E%A5"))
            .andExpect(status().isCreated());

        mockMvc.perform(get(ROOM))
            .andExpect(jsonPath("$.ownerName").value("방장"));
    }

    @Test
    void help() throws Exception {
        mockMvc.perform(get("/api/v1/help"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sections", hasSize(3)));
    }
}
