/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.matryx.cryptography;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.edec.EdECObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;

import java.io.IOException;
import java.security.*;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * common operations and state per algorithm.
 *
 * @author hal.hildebrand
 */
public class EdDSAOperations {

    public static final String EDDSA_ALGORITHM_NAME = "EdDSA";

    private final ThreadLocal<Signature> signatureCache;
    private final ASN1ObjectIdentifier   curveId;
    private final KeyFactory             keyFactory;
    private final SignatureAlgorithm     signatureAlgorithm;

    public EdDSAOperations(SignatureAlgorithm signatureAlgorithm) {
        this.signatureAlgorithm = signatureAlgorithm;
        var curveName = signatureAlgorithm.curveName().toLowerCase();
        curveId = switch (curveName) {
            case "ed25519" -> EdECObjectIdentifiers.id_Ed25519;
            default -> throw new IllegalArgumentException("Unknown Edwards curve: " + curveName);
        };
        var instanceName = signatureAlgorithm.signatureInstanceName();
        signatureCache = ThreadLocal.withInitial(() -> {
            try {
                return Signature.getInstance(instanceName, ProviderUtils.getProviderBC());
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("Unable to retrieve sig algo: " + instanceName, e);
            }
        });
        try {
            keyFactory = KeyFactory.getInstance(instanceName, ProviderUtils.getProviderBC());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to initialize", e);
        }
    }

    /**
     * @return the raw encoded point of the public key
     */
    public byte[] encode(PublicKey publicKey) {
        var info = SubjectPublicKeyInfo.getInstance(publicKey.getEncoded());
        var encoded = info.getPublicKeyData().getBytes();
        if (encoded.length != signatureAlgorithm.publicKeyLength()) {
            throw new IllegalArgumentException("Not an " + signatureAlgorithm.curveName() + " public key");
        }
        return encoded;
    }

    /**
     * @return the raw seed of the private key
     */
    public byte[] encode(PrivateKey privateKey) {
        try {
            var info = PrivateKeyInfo.getInstance(privateKey.getEncoded());
            var seed = ASN1OctetString.getInstance(info.parsePrivateKey()).getOctets();
            if (seed.length != signatureAlgorithm.privateKeyLength()) {
                throw new IllegalArgumentException("Not an " + signatureAlgorithm.curveName() + " private key");
            }
            return seed;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot encode private key", e);
        }
    }

    public KeyPair generateKeyPair() {
        return generateKeyPair(new SecureRandom());
    }

    public KeyPair generateKeyPair(SecureRandom secureRandom) {
        try {
            var kpg = KeyPairGenerator.getInstance(signatureAlgorithm.signatureInstanceName(),
                                                   ProviderUtils.getProviderBC());
            kpg.initialize(256, secureRandom);
            return kpg.generateKeyPair();
        } catch (NoSuchAlgorithmException | InvalidParameterException e) {
            throw new IllegalArgumentException("Cannot generate key pair", e);
        }
    }

    public PrivateKey privateKey(byte[] bytes) {
        if (bytes.length != signatureAlgorithm.privateKeyLength()) {
            throw new IllegalArgumentException(
            "Invalid private key length. Require: " + signatureAlgorithm.privateKeyLength() + " found: "
            + bytes.length);
        }
        try {
            var info = new PrivateKeyInfo(new AlgorithmIdentifier(curveId), new DEROctetString(bytes));
            return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(info.getEncoded()));
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalArgumentException("Cannot decode private key", e);
        }
    }

    public PublicKey publicKey(byte[] bytes) {
        if (bytes.length != signatureAlgorithm.publicKeyLength()) {
            throw new IllegalArgumentException(
            "Invalid public key length. Require: " + signatureAlgorithm.publicKeyLength() + " found: "
            + bytes.length);
        }
        var pubKeyInfo = new SubjectPublicKeyInfo(new AlgorithmIdentifier(curveId), bytes);
        X509EncodedKeySpec x509KeySpec;
        try {
            x509KeySpec = new X509EncodedKeySpec(pubKeyInfo.getEncoded());
        } catch (IOException e1) {
            throw new IllegalArgumentException(e1);
        }

        try {
            return keyFactory.generatePublic(x509KeySpec);
        } catch (InvalidKeySpecException e1) {
            throw new IllegalArgumentException(e1);
        }
    }

    public JohnHancock sign(PrivateKey privateKey, byte[] message) {
        try {
            var sig = signatureCache.get();
            sig.initSign(privateKey);
            sig.update(message);
            return new JohnHancock(signatureAlgorithm, sig.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Cannot sign", e);
        }
    }

    public JohnHancock signature(byte[] signatureBytes) {
        return new JohnHancock(signatureAlgorithm, signatureBytes);
    }

    public boolean verify(PublicKey publicKey, byte[] signature, byte[] message) throws GeneralSecurityException {
        var sig = signatureCache.get();
        sig.initVerify(publicKey);
        sig.update(message);
        return sig.verify(signature);
    }

    @Override
    public String toString() {
        return "EdDSA[" + signatureAlgorithm.curveName() + "]";
    }
}
