/*
 * Copyright 2025 Yelp Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.yelp.ingestion.appsinstalled.common;

import com.google.common.primitives.UnsignedInts;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Protobuf wire-format codec for {@link UserApps}. The layout matches the message
 *
 * <pre>
 * message UserApps {
 *   repeated uint32 apps = 1;
 *   optional double lat = 2;
 *   optional double lon = 3;
 * }
 * </pre>
 *
 * <p>Encoding is byte-stable: fields are written in field-number order and apps are not packed.
 * Decoding accepts both packed and unpacked app lists.
 */
public final class UserAppsCodec {
  static final int APPS_FIELD = 1;
  static final int LAT_FIELD = 2;
  static final int LON_FIELD = 3;

  private UserAppsCodec() {}

  public static byte[] encode(UserApps userApps) {
    int size = 0;
    for (long app : userApps.getApps()) {
      size += CodedOutputStream.computeUInt32Size(APPS_FIELD, UnsignedInts.checkedCast(app));
    }
    size += CodedOutputStream.computeDoubleSize(LAT_FIELD, userApps.getLat());
    size += CodedOutputStream.computeDoubleSize(LON_FIELD, userApps.getLon());

    byte[] packed = new byte[size];
    CodedOutputStream output = CodedOutputStream.newInstance(packed);
    try {
      for (long app : userApps.getApps()) {
        output.writeUInt32(APPS_FIELD, UnsignedInts.checkedCast(app));
      }
      output.writeDouble(LAT_FIELD, userApps.getLat());
      output.writeDouble(LON_FIELD, userApps.getLon());
      output.checkNoSpaceLeft();
    } catch (IOException e) {
      // Only possible if the computed size is wrong
      throw new UncheckedIOException("Failed to encode UserApps", e);
    }
    return packed;
  }

  public static UserApps decode(byte[] packed) throws InvalidProtocolBufferException {
    CodedInputStream input = CodedInputStream.newInstance(packed);
    List<Long> apps = new ArrayList<>();
    double lat = 0.0;
    double lon = 0.0;
    try {
      int tag;
      while ((tag = input.readTag()) != 0) {
        int field = WireFormat.getTagFieldNumber(tag);
        int wireType = WireFormat.getTagWireType(tag);
        if (field == APPS_FIELD && wireType == WireFormat.WIRETYPE_VARINT) {
          apps.add(UnsignedInts.toLong(input.readUInt32()));
        } else if (field == APPS_FIELD && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
          int limit = input.pushLimit(input.readRawVarint32());
          while (input.getBytesUntilLimit() > 0) {
            apps.add(UnsignedInts.toLong(input.readUInt32()));
          }
          input.popLimit(limit);
        } else if (field == LAT_FIELD && wireType == WireFormat.WIRETYPE_FIXED64) {
          lat = input.readDouble();
        } else if (field == LON_FIELD && wireType == WireFormat.WIRETYPE_FIXED64) {
          lon = input.readDouble();
        } else if (!input.skipField(tag)) {
          break;
        }
      }
    } catch (InvalidProtocolBufferException e) {
      throw e;
    } catch (IOException e) {
      throw new InvalidProtocolBufferException(e);
    }
    return new UserApps(lat, lon, apps);
  }
}
