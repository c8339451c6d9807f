package com.whyline.recorder;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import java.util.Map;

/**
 * POJO written by {@link TraceJsonExporter}. Values are rendered to text so the
 * document stays readable for arbitrary object graphs.
 */
public class TraceDump {

    @SerializedName("format_version")
    public String formatVersion;

    @SerializedName("event_count")
    public int eventCount;

    @SerializedName("files_traced")
    public List<String> filesTraced;

    @SerializedName("events")
    public List<Event> events;

    public static class Event {
        @SerializedName("id")        public long id;
        @SerializedName("probe_id")  public int probeId;
        @SerializedName("file")      public String file;
        @SerializedName("line")      public int line;
        @SerializedName("kind")      public String kind;
        @SerializedName("thread")    public String thread;
        @SerializedName("timestamp") public String timestamp;
        @SerializedName("payload")   public Map<String, String> payload;
        @SerializedName("locals")    public Map<String, String> locals;
        @SerializedName("globals")   public Map<String, String> globals;
    }
}
