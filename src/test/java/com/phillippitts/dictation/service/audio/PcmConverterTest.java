package com.phillippitts.dictation.service.audio;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PcmConverterTest {

    @Test
    void convertsSamplesToUnitRangeFloats() {
        ByteBuffer pcm = ByteBuffer.allocate(6).order(ByteOrder.LITTLE_ENDIAN);
        pcm.putShort((short) 0).putShort(Short.MIN_VALUE).putShort((short) 16384);

        byte[] out = PcmConverter.pcm16ToFloat32(pcm.array());

        assertThat(out).hasSize(12);
        ByteBuffer floats = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(floats.getFloat()).isEqualTo(0.0f);
        assertThat(floats.getFloat()).isEqualTo(-1.0f);
        assertThat(floats.getFloat()).isCloseTo(0.5f, within(1e-6f));
    }

    @Test
    void trailingOddByteIsIgnored() {
        assertThat(PcmConverter.pcm16ToFloat32(new byte[3])).hasSize(4);
    }
}
