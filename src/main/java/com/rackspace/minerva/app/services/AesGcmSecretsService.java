/*
 * Copyright 2022 Rackspace US, Inc.
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

package com.rackspace.minerva.app.services;

import com.rackspace.minerva.app.config.SecurityProperties;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Encrypts data source secrets with AES-256-GCM. A payload is the 12 byte IV followed by
 * the ciphertext and its tag.
 */
@Service
public class AesGcmSecretsService implements SecretsService {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int IV_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;

  private final SecretKeySpec key;
  private final SecureRandom random = new SecureRandom();

  public AesGcmSecretsService(SecurityProperties securityProperties) {
    this.key = deriveKey(securityProperties.getSecretKey());
  }

  @Override
  public byte[] encrypt(String plaintext) {
    final byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
      final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return ByteBuffer.allocate(iv.length + ciphertext.length)
          .put(iv)
          .put(ciphertext)
          .array();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to encrypt secret", e);
    }
  }

  @Override
  public String decrypt(byte[] payload) {
    if (payload == null || payload.length <= IV_LENGTH) {
      throw new IllegalArgumentException("Secret payload is too short");
    }
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key,
          new GCMParameterSpec(TAG_LENGTH_BITS, payload, 0, IV_LENGTH));
      final byte[] plaintext = cipher.doFinal(payload, IV_LENGTH, payload.length - IV_LENGTH);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to decrypt secret", e);
    }
  }

  @Override
  public Mono<Map<String, String>> decryptJsonData(Map<String, byte[]> secureJsonData) {
    return Mono.fromCallable(() -> {
      final Map<String, String> decrypted = new HashMap<>();
      for (Map.Entry<String, byte[]> entry : secureJsonData.entrySet()) {
        decrypted.put(entry.getKey(), decrypt(entry.getValue()));
      }
      return decrypted;
    });
  }

  private static SecretKeySpec deriveKey(String secretKey) {
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256")
          .digest(secretKey.getBytes(StandardCharsets.UTF_8));
      return new SecretKeySpec(digest, "AES");
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
