package fk.treestats.aggregation.serialize;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import fk.treestats.aggregation.DescendantTreeCount;

import java.io.IOException;
import java.util.List;

public class CustomSerializers {

    public static void registerSerializers(ObjectMapper om) {
        SimpleModule module = new SimpleModule("treestatsSerializers", new Version(1, 0, 0, null, null, null));
        module.addSerializer(DescendantTreeCount.class, new DescendantTreeCountSerializer());
        om.registerModule(module);
    }

    /**
     * Writes a statistics node and, recursively, its children. The wrapped value goes through the mapper's default
     * serialization.
     */
    static class DescendantTreeCountSerializer extends StdSerializer<DescendantTreeCount> {

        DescendantTreeCountSerializer() {
            super(DescendantTreeCount.class);
        }

        @Override
        public void serialize(DescendantTreeCount value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName("node");
            serializers.defaultSerializeValue(value.getValue(), gen);
            gen.writeNumberField("count", value.getCount());
            gen.writeNumberField("childrenCount", value.getChildrenCount());
            gen.writeNumberField("ratioToParent", value.getRatioToParent());
            gen.writeNumberField("ratioToRoot", value.getRatioToRoot());
            gen.writeNumberField("belowThresholdCount", value.getBelowThresholdCount());

            gen.writeFieldName("children");
            gen.writeStartArray();
            List<DescendantTreeCount> children = value.getChildren();
            for(DescendantTreeCount child : children) {
                this.serialize(child, gen, serializers);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }
}
